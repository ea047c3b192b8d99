package com.example.mafiaparty.global.error;

public enum ErrorCategory {
    VALIDATION,     // 필드 누락/형식 오류
    AUTHORIZATION,  // 호스트 전용 요청을 호스트가 아닌 사용자가 보냄, 개발 모드 밖의 개발 요청
    NOT_FOUND,      // 존재하지 않는 방/플레이어
    PRECONDITION    // 잘못된 페이즈, 종료된 게임, 인원 부족
}
