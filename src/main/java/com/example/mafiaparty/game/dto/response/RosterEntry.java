package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.room.domain.ClientId;

public record RosterEntry(ClientId clientId, String name, boolean alive) {
}
