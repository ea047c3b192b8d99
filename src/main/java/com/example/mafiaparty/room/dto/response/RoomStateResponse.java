package com.example.mafiaparty.room.dto.response;

import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.room.domain.Room;

import java.util.List;

public record RoomStateResponse(
        String roomCode,
        boolean hostConnected,
        boolean devMode,
        String currentGame,
        GamePhase phase,
        List<PlayerSummary> players
) {
    public static RoomStateResponse from(Room room) {
        GamePhase phase = room.getGame() != null ? room.getGame().getPhase() : GamePhase.LOBBY;
        List<PlayerSummary> players = room.getPlayerList().stream()
                .map(PlayerSummary::from)
                .toList();
        return new RoomStateResponse(room.getCode(), room.getHostConnection() != null, room.isDevMode(),
                room.getCurrentGame(), phase, players);
    }
}
