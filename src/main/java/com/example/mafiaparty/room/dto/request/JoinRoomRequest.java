package com.example.mafiaparty.room.dto.request;

public record JoinRoomRequest(String roomCode, String clientId, String name) {
}
