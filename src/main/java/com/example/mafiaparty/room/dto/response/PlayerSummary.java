package com.example.mafiaparty.room.dto.response;

import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.RoomPlayer;

public record PlayerSummary(
        ClientId clientId,
        String name,
        boolean ready,
        boolean connected,
        int score
) {
    public static PlayerSummary from(RoomPlayer player) {
        return new PlayerSummary(player.getClientId(), player.getDisplayName(), player.isReady(),
                player.isConnected(), player.getScore());
    }
}
