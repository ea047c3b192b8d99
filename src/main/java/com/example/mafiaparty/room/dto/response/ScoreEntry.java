package com.example.mafiaparty.room.dto.response;

import com.example.mafiaparty.room.domain.ClientId;

public record ScoreEntry(ClientId clientId, String name, int score) {
}
