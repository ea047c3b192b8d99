package com.example.mafiaparty.game.dto.request;

public record DevRoleRequest(String roomCode, String targetId, String role) {
}
