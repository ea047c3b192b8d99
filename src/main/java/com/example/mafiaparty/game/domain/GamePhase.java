package com.example.mafiaparty.game.domain;

public enum GamePhase {
    LOBBY,          // 대기실 (게임 없음)
    ROLE_REVEAL,    // 역할 확인
    NIGHT,          // 밤 (마피아/의사/탐정 행동)
    DAY_DISCUSSION, // 낮 토론
    VOTE,           // 낮 투표
    RESOLUTION,     // 투표 결과 발표
    ENDED           // 게임 종료
}
