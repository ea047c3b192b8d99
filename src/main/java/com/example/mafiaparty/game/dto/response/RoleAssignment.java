package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.Team;

public record RoleAssignment(PlayerRole role, Team team, String roleDescription) {

    public static RoleAssignment of(PlayerRole role) {
        return new RoleAssignment(role, role.getTeam(), role.getDescription());
    }
}
