package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.game.domain.Investigation;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.Team;
import com.example.mafiaparty.room.domain.ClientId;

import java.util.List;

public record SelfView(
        ClientId clientId,
        PlayerRole role,
        Team team,
        boolean alive,
        ClientId nightTarget,
        ClientId vote,
        List<Investigation> investigations
) {
}
