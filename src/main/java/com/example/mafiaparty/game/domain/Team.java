package com.example.mafiaparty.game.domain;

public enum Team {
    MAFIA,
    TOWN
}
