package com.example.mafiaparty.room.service;

import com.example.mafiaparty.global.concurrency.LockStrategy;
import com.example.mafiaparty.global.config.PartyProperties;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.CloseReason;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * 안정적인 식별자(clientId)와 일시적인 연결(STOMP 세션)을 이어 준다.
 * 재접속하면 그 연결에만 전체 상태를 다시 보내고, 연결이 끊겨도 플레이어는 게임에 남는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresenceService {

    private final RoomRegistry roomRegistry;
    private final RoomService roomService;
    private final RoomEventPublisher eventPublisher;
    private final RoomValidator validator;
    private final HostGraceTimerService graceTimerService;
    private final LockStrategy lockStrategy;
    private final PartyProperties properties;

    /**
     * 호스트 화면 재연결. 방의 호스트 식별자만 붙을 수 있고, 대기 중인 방 종료 타이머를 취소한다.
     */
    public void attachHost(String rawCode, String rawHostId, String connectionId) {
        String code = RoomCodeGenerator.normalize(rawCode);
        lockStrategy.executeWithLock(Room.lockKey(code), () -> {
            Room room = roomRegistry.getRoom(code);
            ClientId hostId = validator.requireClientId(rawHostId);
            if (!room.isHost(hostId)) {
                throw ErrorCode.NOT_HOST.commonException();
            }

            String previous = room.getHostConnection();
            if (previous != null && !previous.equals(connectionId)) {
                roomRegistry.unbindConnection(previous, code);
            }
            room.setHostConnection(connectionId);
            roomRegistry.bindConnection(connectionId, code);
            boolean cancelled = graceTimerService.cancel(code);
            log.info("[호스트재연결] room={}, graceCancelled={}", code, cancelled);

            eventPublisher.resyncHost(room);
            eventPublisher.publishRoomState(room);
        });
    }

    /**
     * 플레이어 재연결. 방에 없는 식별자는 PLAYER_NOT_FOUND.
     */
    public void attachPlayer(String rawCode, String rawClientId, String connectionId) {
        String code = RoomCodeGenerator.normalize(rawCode);
        lockStrategy.executeWithLock(Room.lockKey(code), () -> {
            Room room = roomRegistry.getRoom(code);
            ClientId clientId = validator.requireClientId(rawClientId);
            RoomPlayer player = RoomService.requirePlayer(room, clientId);

            roomService.rebind(room, player, connectionId);
            log.info("[재연결] room={}, clientId={}", code, clientId);

            eventPublisher.resyncPlayer(room, player);
            eventPublisher.publishRoomState(room);
        });
    }

    /**
     * 연결 해제. 호스트면 유예 타이머를 걸고, 플레이어면 연결만 비운다.
     */
    public void detach(String connectionId) {
        String code = roomRegistry.unbindConnection(connectionId);
        if (code == null) {
            return;
        }
        String lockKey = Room.lockKey(code);
        boolean closed = lockStrategy.executeWithLock(lockKey, () -> {
            Optional<Room> found = roomRegistry.find(code);
            if (found.isEmpty()) {
                return false;
            }
            Room room = found.get();

            if (room.isHostConnection(connectionId)) {
                room.setHostConnection(null);
                return onHostLost(room);
            }
            room.findPlayerByConnection(connectionId).ifPresent(player -> {
                player.setConnectionId(null);
                log.info("[연결끊김] room={}, clientId={}", code, player.getClientId());
                eventPublisher.publishRoomState(room);
            });
            return false;
        });
        if (closed) {
            lockStrategy.release(lockKey);
        }
    }

    /**
     * @return 유예 없이 방을 바로 닫았으면 true
     */
    private boolean onHostLost(Room room) {
        String code = room.getCode();
        int graceSeconds = properties.getRoom().getHostGraceSeconds();
        if (graceSeconds <= 0) {
            return roomService.closeRoom(code, CloseReason.HOST_LEFT);
        }
        log.info("[호스트연결끊김] room={}, graceSeconds={}", code, graceSeconds);
        graceTimerService.schedule(code, Duration.ofSeconds(graceSeconds), () -> expireHost(code));
        eventPublisher.publishRoomState(room);
        return false;
    }

    /**
     * 유예 시간이 끝났는데 호스트가 돌아오지 않았으면 방을 닫는다.
     */
    void expireHost(String code) {
        String lockKey = Room.lockKey(code);
        boolean closed = lockStrategy.executeWithLock(lockKey, () -> {
            Optional<Room> found = roomRegistry.find(code);
            return found.isPresent() && found.get().getHostConnection() == null
                    && roomService.closeRoom(code, CloseReason.HOST_LEFT);
        });
        if (closed) {
            lockStrategy.release(lockKey);
        }
    }
}
