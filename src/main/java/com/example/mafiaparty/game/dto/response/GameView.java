package com.example.mafiaparty.game.dto.response;

import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.domain.Team;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 시청자별로 가려진 게임 상태. self 는 플레이어 본인에게만, progress 는 호스트에게만 채워진다.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameView {
    private final String roomCode;
    private final GamePhase phase;
    private final int round;
    private final List<RosterEntry> roster;
    private final ResolutionView lastResolution;
    private final Team winningTeam;
    private final SelfView self;
    private final HostProgress progress;
}
