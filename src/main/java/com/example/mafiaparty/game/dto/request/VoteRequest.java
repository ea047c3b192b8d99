package com.example.mafiaparty.game.dto.request;

public record VoteRequest(String roomCode, String clientId, String targetId) {
}
