package com.example.mafiaparty.room.dto.response;

import com.example.mafiaparty.room.domain.GameRecord;
import com.example.mafiaparty.room.domain.Room;

import java.util.Comparator;
import java.util.List;

/**
 * 허브 화면: 점수판, 지난 게임 기록, 현재 선택된 게임
 */
public record HubStateResponse(
        String roomCode,
        String currentGame,
        boolean gameInProgress,
        List<ScoreEntry> scoreboard,
        List<GameRecord> history
) {
    public static HubStateResponse from(Room room) {
        List<ScoreEntry> scoreboard = room.getPlayerList().stream()
                .map(p -> new ScoreEntry(p.getClientId(), p.getDisplayName(), p.getScore()))
                .sorted(Comparator.comparingInt(ScoreEntry::score).reversed())
                .toList();
        return new HubStateResponse(room.getCode(), room.getCurrentGame(), room.hasRunningGame(),
                scoreboard, List.copyOf(room.getHistory()));
    }
}
