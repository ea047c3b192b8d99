package com.example.mafiaparty.room.dto.request;

public record AttachHostRequest(String roomCode, String hostId) {
}
