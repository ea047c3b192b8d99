package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.game.domain.ResolutionType;
import com.example.mafiaparty.room.domain.ClientId;

public record ResolutionView(
        ResolutionType type,
        int round,
        ClientId died,
        String diedName,
        ClientId eliminated,
        String eliminatedName,
        boolean tie
) {
}
