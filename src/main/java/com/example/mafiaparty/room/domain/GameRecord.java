package com.example.mafiaparty.room.domain;

import com.example.mafiaparty.game.domain.Team;

import java.time.Instant;
import java.util.List;

/**
 * 끝난 게임 한 판의 기록 (허브 화면의 히스토리)
 */
public record GameRecord(
        String gameKey,
        int rounds,
        Team winningTeam,
        List<String> winners,
        Instant startedAt,
        Instant endedAt
) {
}
