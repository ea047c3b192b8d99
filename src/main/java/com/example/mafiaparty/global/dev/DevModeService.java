package com.example.mafiaparty.global.dev;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.dto.response.RoleRevealEntry;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.global.concurrency.LockStrategy;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.service.RoomCodeGenerator;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import com.example.mafiaparty.room.service.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;

/**
 * 개발 모드 전용 조작. 개발 모드가 켜진 방의 호스트 연결에서만 동작하고, 그 외에는 조용히 무시된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DevModeService {

    private final RoomRegistry roomRegistry;
    private final RoomEventPublisher eventPublisher;
    private final PhaseResultProcessor resultProcessor;
    private final LockStrategy lockStrategy;

    /**
     * 전체 역할/생존 목록을 호스트 연결에만 보낸다.
     */
    public void revealAllRoles(String rawCode, String connectionId) {
        withDevGame(rawCode, connectionId, (room, game) -> {
            List<RoleRevealEntry> entries = game.getParticipants().stream()
                    .map(id -> new RoleRevealEntry(id, game.nameOf(id), game.roleOf(id), game.isAlive(id)))
                    .toList();
            log.info("[DEV] 역할 공개: room={}", room.getCode());
            eventPublisher.sendRolesRevealed(room, entries);
        });
    }

    /**
     * 역할 강제 변경. 대상 플레이어에게 새 역할과 화면을 다시 보낸다.
     */
    public void setRole(String rawCode, String connectionId, String rawTargetId, String rawRole) {
        withDevGame(rawCode, connectionId, (room, game) -> {
            ClientId target = requireParticipant(game, rawTargetId);
            PlayerRole role = parseRole(rawRole);
            game.assignRole(target, role);
            // 이전 역할로 낸 밤 행동이 새 역할로 처리되지 않도록 버린다
            game.clearNightSelection(target);
            log.info("[DEV] 역할 변경: room={}, target={}, role={}", room.getCode(), target, role);

            eventPublisher.sendRoleAssignment(room, target);
            RoomPlayer player = room.findPlayer(target);
            if (player != null) {
                eventPublisher.sendPlayerView(room, player);
            }
            eventPublisher.sendHostView(room);
        });
    }

    /**
     * 생존 여부 뒤집기. 승패를 다시 판정한다.
     */
    public void toggleAlive(String rawCode, String connectionId, String rawTargetId) {
        withDevGame(rawCode, connectionId, (room, game) -> {
            ClientId target = requireParticipant(game, rawTargetId);
            game.setAlive(target, !game.isAlive(target));
            log.info("[DEV] 생존 토글: room={}, target={}, alive={}", room.getCode(), target, game.isAlive(target));

            resultProcessor.checkGameEnd(room, game);
            eventPublisher.publishAll(room);
        });
    }

    private void withDevGame(String rawCode, String connectionId, BiConsumer<Room, GameInstance> action) {
        String code = RoomCodeGenerator.normalize(rawCode);
        lockStrategy.executeWithLock(Room.lockKey(code), () -> {
            Room room = roomRegistry.getRoom(code);
            if (!room.isDevMode() || !room.isHostConnection(connectionId)) {
                throw ErrorCode.DEV_MODE_REQUIRED.commonException();
            }
            GameInstance game = room.getGame();
            if (game == null || game.isEnded()) {
                log.debug("[DEV] 진행 중인 게임 없음: room={}", code);
                return;
            }
            action.accept(room, game);
        });
    }

    private ClientId requireParticipant(GameInstance game, String rawTargetId) {
        if (!StringUtils.hasText(rawTargetId)) {
            throw ErrorCode.PLAYER_NOT_FOUND.commonException();
        }
        ClientId target = ClientId.of(rawTargetId.trim());
        if (!game.isParticipant(target)) {
            throw ErrorCode.PLAYER_NOT_FOUND.commonException();
        }
        return target;
    }

    private PlayerRole parseRole(String rawRole) {
        if (!StringUtils.hasText(rawRole)) {
            throw ErrorCode.INVALID_ROLE.commonException();
        }
        try {
            return PlayerRole.valueOf(rawRole.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ErrorCode.INVALID_ROLE.commonException();
        }
    }
}
