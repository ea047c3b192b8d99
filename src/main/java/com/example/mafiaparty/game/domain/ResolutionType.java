package com.example.mafiaparty.game.domain;

public enum ResolutionType {
    NIGHT,
    DAY
}
