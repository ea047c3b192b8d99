package com.example.mafiaparty.room.dto.request;

public record DevModeRequest(String roomCode, boolean enabled) {
}
