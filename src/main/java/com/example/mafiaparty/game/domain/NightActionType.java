package com.example.mafiaparty.game.domain;

public enum NightActionType {
    KILL,   // 마피아
    SAVE,   // 의사
    CHECK   // 탐정
}
