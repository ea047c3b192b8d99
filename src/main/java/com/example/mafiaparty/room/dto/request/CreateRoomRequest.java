package com.example.mafiaparty.room.dto.request;

public record CreateRoomRequest(String hostId) {
}
