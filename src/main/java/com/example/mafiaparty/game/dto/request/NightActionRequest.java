package com.example.mafiaparty.game.dto.request;

public record NightActionRequest(String roomCode, String clientId, String action, String targetId) {
}
