package com.example.mafiaparty.game.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.Investigation;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.ResolutionResult;
import com.example.mafiaparty.game.domain.Team;
import com.example.mafiaparty.game.strategy.NightActionResult;
import com.example.mafiaparty.game.strategy.RoleActionFactory;
import com.example.mafiaparty.game.strategy.RoleActionStrategy;
import com.example.mafiaparty.global.config.PartyProperties;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.GameRecord;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 페이즈 종료 시 결과 처리를 담당하는 서비스
 * State Pattern의 onExit()에서 콜백으로 호출됩니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhaseResultProcessor {

    private final RoleActionFactory roleActionFactory;
    private final RoomEventPublisher eventPublisher;
    private final PartyProperties properties;

    // ==================== 밤 결과 처리 ====================

    /**
     * NIGHT 종료 시: 마피아 공격, 의사 보호, 탐정 조사 처리
     */
    public void processNight(Room room, GameInstance game) {
        List<NightActionResult> results = collectNightResults(game);

        ClientId mafiaTarget = selectMafiaTarget(results);
        ClientId savedTarget = results.stream()
                .filter(r -> r.getActorRole() == PlayerRole.DOCTOR)
                .map(NightActionResult::getTargetId)
                .findFirst()
                .orElse(null);

        ClientId died = null;
        if (mafiaTarget != null && !mafiaTarget.equals(savedTarget)) {
            game.setAlive(mafiaTarget, false);
            died = mafiaTarget;
        }

        // 그날 밤 죽은 탐정은 결과를 받지 못한다
        results.stream()
                .filter(r -> r.getActorRole() == PlayerRole.DETECTIVE)
                .filter(r -> game.isAlive(r.getActorId()))
                .forEach(r -> recordInvestigation(room, game, r));

        game.setLastResolution(ResolutionResult.night(game.getRound(), died));
        game.clearNightSelections();
        log.info("[밤결과] room={}, round={}, killTarget={}, saved={}, died={}",
                room.getCode(), game.getRound(), mafiaTarget, savedTarget, died);

        checkGameEnd(room, game);
    }

    private List<NightActionResult> collectNightResults(GameInstance game) {
        List<NightActionResult> results = new ArrayList<>();
        for (Map.Entry<ClientId, ClientId> selection : game.getNightSelections().entrySet()) {
            ClientId actor = selection.getKey();
            ClientId target = selection.getValue();
            if (!game.isAlive(actor) || !game.isAlive(target)) {
                continue;
            }
            RoleActionStrategy strategy = roleActionFactory.getStrategy(game.roleOf(actor));
            if (strategy != null && strategy.canTarget(game, actor, target)) {
                results.add(strategy.execute(game, actor, target));
            }
        }
        return results;
    }

    /**
     * 마피아들의 지목 중 최다 득표 대상. 동률이면 가장 나중에 지목된 대상을 고른다.
     * results 는 제출 순서(오래된 것 → 최근)로 정렬되어 있다.
     */
    private ClientId selectMafiaTarget(List<NightActionResult> results) {
        Map<ClientId, Long> counts = new HashMap<>();
        Map<ClientId, Integer> lastSeen = new HashMap<>();
        for (int i = 0; i < results.size(); i++) {
            NightActionResult r = results.get(i);
            if (r.getActorRole() != PlayerRole.MAFIA) {
                continue;
            }
            counts.merge(r.getTargetId(), 1L, Long::sum);
            lastSeen.put(r.getTargetId(), i);
        }
        if (counts.isEmpty()) {
            return null;
        }
        long max = Collections.max(counts.values());
        return counts.entrySet().stream()
                .filter(e -> e.getValue() == max)
                .map(Map.Entry::getKey)
                .max(Comparator.comparingInt(lastSeen::get))
                .orElse(null);
    }

    private void recordInvestigation(Room room, GameInstance game, NightActionResult result) {
        Investigation investigation = new Investigation(game.getRound(), result.getTargetId(),
                game.nameOf(result.getTargetId()), result.isTargetIsMafia());
        game.addInvestigation(result.getActorId(), investigation);
        log.debug("[탐정조사] room={}, detective={}, target={}", room.getCode(), result.getActorId(),
                result.getTargetId());
        eventPublisher.sendInvestigation(room, result.getActorId(), investigation);
    }

    // ==================== 낮 투표 처리 ====================

    /**
     * VOTE 종료 시: 투표 집계 및 처형. 최다 득표가 동률이면 아무도 처형되지 않는다.
     */
    public void processDayVoting(Room room, GameInstance game) {
        List<ClientId> topVoted = getTopVotedPlayers(game);

        ClientId eliminated = null;
        boolean tie = topVoted.size() > 1;
        if (topVoted.size() == 1) {
            eliminated = topVoted.get(0);
            game.setAlive(eliminated, false);
        }

        game.setLastResolution(ResolutionResult.day(game.getRound(), eliminated, tie));
        game.clearVotes();
        log.info("[투표결과] room={}, round={}, eliminated={}, tie={}",
                room.getCode(), game.getRound(), eliminated, tie);

        checkGameEnd(room, game);
    }

    /**
     * 살아있는 투표자가 살아있는 대상에게 던진 표만 집계한다.
     */
    List<ClientId> getTopVotedPlayers(GameInstance game) {
        Map<ClientId, Long> counts = game.getDayVotes().entrySet().stream()
                .filter(v -> game.isAlive(v.getKey()) && game.isAlive(v.getValue()))
                .collect(Collectors.groupingBy(Map.Entry::getValue, Collectors.counting()));
        if (counts.isEmpty()) {
            return List.of();
        }
        long max = Collections.max(counts.values());
        return counts.entrySet().stream()
                .filter(e -> e.getValue() == max)
                .map(Map.Entry::getKey)
                .toList();
    }

    // ==================== 게임 종료 체크 ====================

    /**
     * 마피아 전멸 → 시민 승리, 마피아 >= 시민 → 마피아 승리
     */
    public Team evaluateWinner(GameInstance game) {
        long mafia = game.countAlive(Team.MAFIA);
        long town = game.countAlive(Team.TOWN);
        if (mafia == 0) {
            return Team.TOWN;
        }
        if (mafia >= town) {
            return Team.MAFIA;
        }
        return null;
    }

    /**
     * 승패가 정해졌으면 게임을 ENDED 로 바꾸고 점수를 한 번만 지급한다.
     *
     * @return 게임이 종료 상태이면 true
     */
    public boolean checkGameEnd(Room room, GameInstance game) {
        if (game.isEnded()) {
            return true;
        }
        Team winner = evaluateWinner(game);
        if (winner == null) {
            return false;
        }
        game.declareWinner(winner);
        awardPoints(room, game);
        log.info("[게임종료] room={}, winner={}, round={}", room.getCode(), winner, game.getRound());
        return true;
    }

    private void awardPoints(Room room, GameInstance game) {
        if (!game.markPointsAwarded()) {
            return;
        }
        List<String> winners = new ArrayList<>();
        for (ClientId id : game.getParticipants()) {
            if (game.roleOf(id).getTeam() != game.getWinningTeam()) {
                continue;
            }
            winners.add(game.nameOf(id));
            RoomPlayer player = room.findPlayer(id);
            if (player != null) {
                player.addScore(properties.getGame().getPointsPerWin());
            }
        }
        room.addHistory(new GameRecord(game.getGameKey(), game.getRound(), game.getWinningTeam(),
                List.copyOf(winners), game.getStartedAt(), Instant.now()));
    }
}
