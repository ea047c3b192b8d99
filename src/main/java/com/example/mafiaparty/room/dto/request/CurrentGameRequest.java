package com.example.mafiaparty.room.dto.request;

public record CurrentGameRequest(String roomCode, String gameKey) {
}
