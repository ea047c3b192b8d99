package com.example.mafiaparty.room.dto.request;

public record ReadyRequest(String roomCode, String clientId, boolean ready) {
}
