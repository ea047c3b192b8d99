package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.room.domain.ClientId;

/**
 * 개발 모드 전체 역할 공개용
 */
public record RoleRevealEntry(ClientId clientId, String name, PlayerRole role, boolean alive) {
}
