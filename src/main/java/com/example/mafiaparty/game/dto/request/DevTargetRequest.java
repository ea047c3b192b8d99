package com.example.mafiaparty.game.dto.request;

public record DevTargetRequest(String roomCode, String targetId) {
}
