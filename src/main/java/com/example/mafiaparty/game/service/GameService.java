package com.example.mafiaparty.game.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.domain.NightActionType;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.dto.response.GameView;
import com.example.mafiaparty.game.state.GamePhaseFactory;
import com.example.mafiaparty.game.state.GamePhaseState;
import com.example.mafiaparty.game.strategy.RoleActionFactory;
import com.example.mafiaparty.game.strategy.RoleActionStrategy;
import com.example.mafiaparty.global.concurrency.LockStrategy;
import com.example.mafiaparty.global.config.PartyProperties;
import com.example.mafiaparty.global.error.CommonException;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.service.RoomCodeGenerator;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import com.example.mafiaparty.room.service.RoomRegistry;
import com.example.mafiaparty.room.service.RoomValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 방 하나의 게임 진행 (역할 배정, 밤 행동/투표 접수, 페이즈 전환).
 * 모든 조작은 방 락 안에서 일어나고, 변경 직후 같은 락 안에서 시청자별 화면을 다시 보낸다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final RoomRegistry roomRegistry;
    private final RoomValidator validator;
    private final RoomEventPublisher eventPublisher;
    private final RoleAssigner roleAssigner;
    private final GameViewProjector projector;
    private final GamePhaseFactory phaseFactory;
    private final PhaseResultProcessor resultProcessor;
    private final RoleActionFactory roleActionFactory;
    private final LockStrategy lockStrategy;
    private final PartyProperties properties;

    // ==================== 게임 시작/종료 ====================

    public void startGame(String rawCode, String connectionId) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            if (room.hasRunningGame()) {
                throw ErrorCode.GAME_IN_PROGRESS.commonException();
            }
            int minPlayers = room.isDevMode()
                    ? properties.getGame().getDevMinPlayers()
                    : properties.getGame().getMinPlayers();
            if (room.getPlayers().size() < minPlayers) {
                throw new CommonException(ErrorCode.NEED_MIN_PLAYERS, Map.of("minPlayers", minPlayers));
            }
            if (!room.allReady()) {
                throw ErrorCode.NOT_ALL_READY.commonException();
            }

            Map<ClientId, String> names = new LinkedHashMap<>();
            for (RoomPlayer player : room.getPlayerList()) {
                names.put(player.getClientId(), player.getDisplayName());
            }
            Map<ClientId, PlayerRole> roles = roleAssigner.assignRoles(List.copyOf(names.keySet()));
            GameInstance game = new GameInstance(room.getCurrentGame(), names, roles, Instant.now());
            room.setGame(game);

            log.info("[게임시작] room={}, players={}, mafia={}", room.getCode(), names.size(),
                    RoleAssigner.mafiaCount(names.size()));

            names.keySet().forEach(id -> eventPublisher.sendRoleAssignment(room, id));
            eventPublisher.publishAll(room);
        });
    }

    /**
     * 게임을 버리고 로비로. 점수와 기록은 남고 준비 상태만 초기화된다.
     */
    public void backToLobby(String rawCode, String connectionId) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            room.setGame(null);
            room.resetReady();
            log.info("[로비복귀] room={}", room.getCode());
            eventPublisher.publishAll(room);
        });
    }

    // ==================== 페이즈 진행 ====================

    /**
     * 호스트의 다음 단계 요청. LOBBY/ENDED 에서는 아무 일도 없다.
     */
    public void advancePhase(String rawCode, String connectionId) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            GameInstance game = room.getGame();
            if (game != null && transition(room, game)) {
                eventPublisher.publishAll(room);
            }
        });
    }

    public void forceResolveNight(String rawCode, String connectionId) {
        forceResolve(rawCode, connectionId, GamePhase.NIGHT);
    }

    public void forceResolveDay(String rawCode, String connectionId) {
        forceResolve(rawCode, connectionId, GamePhase.VOTE);
    }

    private void forceResolve(String rawCode, String connectionId, GamePhase expected) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            GameInstance game = room.getGame();
            if (game == null || game.getPhase() != expected) {
                log.debug("[강제진행무시] room={}, expected={}", room.getCode(), expected);
                return;
            }
            transition(room, game);
            eventPublisher.publishAll(room);
        });
    }

    /**
     * 현재 페이즈를 마무리하고 다음 페이즈로 옮긴다.
     *
     * @return 전환이 일어났으면 true
     */
    boolean transition(Room room, GameInstance game) {
        GamePhaseState current = phaseFactory.getState(game.getPhase());
        if (current == null) {
            return false;
        }
        GamePhase from = game.getPhase();
        current.onExit(room, game, resultProcessor);
        if (game.isEnded()) {
            return true;
        }

        GamePhase next = current.nextPhase(game);
        game.moveTo(next);
        GamePhaseState nextState = phaseFactory.getState(next);
        if (nextState != null) {
            nextState.process(game);
        }
        log.info("[페이즈전환] room={}, {} -> {}, round={}", room.getCode(), from, next, game.getRound());
        return true;
    }

    // ==================== 행동 접수 ====================

    /**
     * 밤 행동 접수. 다시 보내면 덮어쓴다. 살아있는 능력자가 모두 보내면 바로 밤을 처리한다.
     */
    public void submitNightAction(String rawCode, String rawClientId, String rawAction, String rawTargetId) {
        withGame(rawCode, (room, game) -> {
            ClientId actor = validator.requireClientId(rawClientId);
            NightActionType action = parseAction(rawAction);
            ClientId target = requireTarget(rawTargetId);

            if (game.getPhase() != GamePhase.NIGHT || !game.isAlive(actor) || !game.isAlive(target)) {
                throw reject(room, "night", actor);
            }
            PlayerRole role = game.roleOf(actor);
            if (role.getNightAction() != action) {
                throw reject(room, "night-role", actor);
            }
            RoleActionStrategy strategy = roleActionFactory.getStrategy(role);
            if (strategy == null || !strategy.canTarget(game, actor, target)) {
                throw reject(room, "night-target", actor);
            }

            game.recordNightSelection(actor, target);
            log.debug("[밤행동] room={}, actor={}, action={}", room.getCode(), actor, action);

            if (game.getNightSelections().keySet().containsAll(game.aliveNightActors())) {
                transition(room, game);
            }
            eventPublisher.publishAll(room);
        });
    }

    /**
     * 투표 접수. 다시 투표하면 덮어쓴다. 살아있는 플레이어가 모두 투표하면 바로 집계한다.
     */
    public void submitVote(String rawCode, String rawClientId, String rawTargetId) {
        withGame(rawCode, (room, game) -> {
            ClientId voter = validator.requireClientId(rawClientId);
            ClientId target = requireTarget(rawTargetId);

            if (game.getPhase() != GamePhase.VOTE || !game.isAlive(voter) || !game.isAlive(target)
                    || voter.equals(target)) {
                throw reject(room, "vote", voter);
            }

            game.recordVote(voter, target);
            log.debug("[투표] room={}, voter={}", room.getCode(), voter);

            if (game.getDayVotes().keySet().containsAll(game.alivePlayers())) {
                transition(room, game);
            }
            eventPublisher.publishAll(room);
        });
    }

    // ==================== 조회 ====================

    /**
     * 호출한 연결이 호스트면 호스트 화면, 아니면 해당 플레이어 화면
     */
    public GameView getGameView(String rawCode, String rawClientId, String connectionId) {
        String code = RoomCodeGenerator.normalize(rawCode);
        return lockStrategy.executeWithLock(Room.lockKey(code), () -> {
            Room room = roomRegistry.getRoom(code);
            if (room.isHostConnection(connectionId)) {
                return projector.project(room, Viewer.host(room.getHostId()));
            }
            return projector.project(room, Viewer.player(validator.requireClientId(rawClientId)));
        });
    }

    // ==================== 헬퍼 ====================

    private NightActionType parseAction(String rawAction) {
        if (!StringUtils.hasText(rawAction)) {
            throw ErrorCode.INVALID_ACTION.commonException();
        }
        try {
            return NightActionType.valueOf(rawAction.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ErrorCode.INVALID_ACTION.commonException();
        }
    }

    private ClientId requireTarget(String rawTargetId) {
        if (!StringUtils.hasText(rawTargetId)) {
            throw ErrorCode.INVALID_ACTION.commonException();
        }
        return ClientId.of(rawTargetId.trim());
    }

    private CommonException reject(Room room, String kind, ClientId actor) {
        log.debug("[행동거부] room={}, kind={}, actor={}", room.getCode(), kind, actor);
        return ErrorCode.INVALID_ACTION.commonException();
    }

    private void withRoom(String rawCode, Consumer<Room> action) {
        String code = RoomCodeGenerator.normalize(rawCode);
        lockStrategy.executeWithLock(Room.lockKey(code), () -> action.accept(roomRegistry.getRoom(code)));
    }

    private void withGame(String rawCode, BiConsumer<Room, GameInstance> action) {
        withRoom(rawCode, room -> {
            GameInstance game = room.getGame();
            if (game == null) {
                throw ErrorCode.INVALID_ACTION.commonException();
            }
            action.accept(room, game);
        });
    }
}
