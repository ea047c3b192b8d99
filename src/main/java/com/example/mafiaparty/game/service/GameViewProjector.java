package com.example.mafiaparty.game.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.ResolutionResult;
import com.example.mafiaparty.game.dto.response.GameView;
import com.example.mafiaparty.game.dto.response.HostProgress;
import com.example.mafiaparty.game.dto.response.ResolutionView;
import com.example.mafiaparty.game.dto.response.RosterEntry;
import com.example.mafiaparty.game.dto.response.SelfView;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 정규 게임 상태를 시청자별 화면으로 가린다. 상태를 바꾸지 않는다.
 * <p>
 * 다른 플레이어의 역할, 밤 대상, 누가 누구에게 투표했는지는 어떤 시청자에게도 나가지 않는다.
 */
@Component
public class GameViewProjector {

    public GameView project(Room room, Viewer viewer) {
        GameInstance game = room.getGame();
        if (game == null) {
            return GameView.builder()
                    .roomCode(room.getCode())
                    .phase(GamePhase.LOBBY)
                    .round(0)
                    .roster(List.of())
                    .build();
        }

        GameView.GameViewBuilder builder = GameView.builder()
                .roomCode(room.getCode())
                .phase(game.getPhase())
                .round(game.getRound())
                .roster(roster(game))
                .lastResolution(resolution(game))
                .winningTeam(game.getWinningTeam());

        if (viewer.host()) {
            builder.progress(progress(game));
        } else if (viewer.clientId() != null && game.isParticipant(viewer.clientId())) {
            builder.self(self(game, viewer.clientId()));
        }
        return builder.build();
    }

    private List<RosterEntry> roster(GameInstance game) {
        return game.getParticipants().stream()
                .map(id -> new RosterEntry(id, game.nameOf(id), game.isAlive(id)))
                .toList();
    }

    private ResolutionView resolution(GameInstance game) {
        ResolutionResult result = game.getLastResolution();
        if (result == null) {
            return null;
        }
        return new ResolutionView(
                result.getType(),
                result.getRound(),
                result.getDied(),
                nameOrNull(game, result.getDied()),
                result.getEliminated(),
                nameOrNull(game, result.getEliminated()),
                result.isTie());
    }

    private SelfView self(GameInstance game, ClientId id) {
        PlayerRole role = game.roleOf(id);
        return new SelfView(
                id,
                role,
                role.getTeam(),
                game.isAlive(id),
                game.getNightSelections().get(id),
                game.getDayVotes().get(id),
                game.investigationsOf(id));
    }

    // 집계만. 누가 제출했는지는 담지 않는다.
    private HostProgress progress(GameInstance game) {
        List<ClientId> actors = game.aliveNightActors();
        List<ClientId> alive = game.alivePlayers();
        int submitted = (int) actors.stream().filter(game.getNightSelections()::containsKey).count();
        int voted = (int) alive.stream().filter(game.getDayVotes()::containsKey).count();
        return new HostProgress(submitted, actors.size(), voted, alive.size());
    }

    private String nameOrNull(GameInstance game, ClientId id) {
        return id == null ? null : game.nameOf(id);
    }
}
