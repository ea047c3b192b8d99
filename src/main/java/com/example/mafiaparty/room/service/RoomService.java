package com.example.mafiaparty.room.service;

import com.example.mafiaparty.global.concurrency.LockStrategy;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.CloseReason;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.room.dto.response.HubStateResponse;
import com.example.mafiaparty.room.dto.response.RoomStateResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Consumer;

/**
 * 방 생성/삭제, 플레이어 입장/준비/퇴장, 호스트 설정.
 * 방 상태를 바꾸는 모든 작업은 방 락 안에서 실행되고, 같은 락 안에서 브로드캐스트한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomService {

    private final RoomRegistry roomRegistry;
    private final RoomEventPublisher eventPublisher;
    private final RoomValidator validator;
    private final HostGraceTimerService graceTimerService;
    private final LockStrategy lockStrategy;

    // ==================== 방 생성/삭제 ====================

    /**
     * 새 방을 만든다. 같은 호스트가 이미 가진 방은 모두 닫는다.
     *
     * @return 새 방 코드
     */
    public String createRoom(String rawHostId, String connectionId) {
        ClientId hostId = validator.requireClientId(rawHostId);

        for (Room previous : roomRegistry.findByHost(hostId)) {
            destroyRoom(previous.getCode(), CloseReason.HOST_RECREATED);
        }

        Room created = roomRegistry.create(hostId, connectionId);
        return lockStrategy.executeWithLock(Room.lockKey(created.getCode()), () -> {
            eventPublisher.sendToConnection(connectionId, MessageType.ROOM_CREATED, created.getCode(),
                    Map.of("roomCode", created.getCode()));
            eventPublisher.resyncHost(created);
            eventPublisher.publishRoomState(created);
            return created.getCode();
        });
    }

    /**
     * 방을 지우고 남아있는 연결들에게 종료 사유를 알린다. 이미 없는 방이면 아무 일도 없다.
     * 같은 방의 락을 이미 잡은 상태에서는 {@link #closeRoom} 을 쓴다.
     */
    public void destroyRoom(String code, CloseReason reason) {
        String lockKey = Room.lockKey(code);
        boolean closed = lockStrategy.executeWithLock(lockKey, () -> closeRoom(code, reason));
        if (closed) {
            lockStrategy.release(lockKey);
        }
    }

    /**
     * 방 락 안에서만 호출한다. 락 객체 정리는 가장 바깥 호출자가 락을 놓은 뒤에 한다.
     *
     * @return 방을 실제로 지웠으면 true
     */
    boolean closeRoom(String code, CloseReason reason) {
        Room removed = roomRegistry.remove(code);
        if (removed == null) {
            return false;
        }
        graceTimerService.cancel(code);
        eventPublisher.publishRoomClosed(code, reason);
        log.info("[방종료] room={}, reason={}", code, reason);
        return true;
    }

    // ==================== 호스트 설정 ====================

    public void setDevMode(String rawCode, boolean enabled, String connectionId) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            room.setDevMode(enabled);
            log.info("[개발모드] room={}, enabled={}", room.getCode(), enabled);
            eventPublisher.publishRoomState(room);
        });
    }

    public void setCurrentGame(String rawCode, String gameKey, String connectionId) {
        withRoom(rawCode, room -> {
            validator.requireHost(room, connectionId);
            if (!Room.DEFAULT_GAME.equals(gameKey)) {
                throw ErrorCode.UNKNOWN_GAME.commonException();
            }
            if (room.hasRunningGame()) {
                throw ErrorCode.GAME_IN_PROGRESS.commonException();
            }
            room.setCurrentGame(gameKey);
            eventPublisher.publishRoomState(room);
            eventPublisher.publishHubState(room);
        });
    }

    // ==================== 플레이어 ====================

    /**
     * 입장. 이미 방에 있는 식별자라면 재접속으로 처리하고 이름만 바꾼다.
     */
    public RoomPlayer join(String rawCode, String rawClientId, String rawName, String connectionId) {
        String code = RoomCodeGenerator.normalize(rawCode);
        return lockStrategy.executeWithLock(Room.lockKey(code), () -> {
            Room room = roomRegistry.getRoom(code);
            String name = validator.requireName(rawName);
            ClientId clientId = validator.requireClientId(rawClientId);

            if (room.isNameTaken(name, clientId)) {
                throw ErrorCode.NAME_ALREADY_TAKEN.commonException();
            }

            RoomPlayer player = room.findPlayer(clientId);
            if (player == null) {
                player = RoomPlayer.builder()
                        .clientId(clientId)
                        .displayName(name)
                        .build();
                room.addPlayer(player);
                log.info("[입장] room={}, clientId={}, name={}", room.getCode(), clientId, name);
            } else {
                player.setDisplayName(name);
                log.info("[재입장] room={}, clientId={}, name={}", room.getCode(), clientId, name);
            }
            rebind(room, player, connectionId);

            eventPublisher.sendToConnection(connectionId, MessageType.PLAYER_JOINED, room.getCode(),
                    Map.of("roomCode", room.getCode(), "clientId", clientId, "name", name));
            eventPublisher.resyncPlayer(room, player);
            eventPublisher.publishRoomState(room);
            eventPublisher.publishHubState(room);
            return player;
        });
    }

    public void setReady(String rawCode, String rawClientId, boolean ready) {
        withRoom(rawCode, room -> {
            RoomPlayer player = requirePlayer(room, validator.requireClientId(rawClientId));
            player.setReady(ready);
            eventPublisher.publishRoomState(room);
        });
    }

    /**
     * 명시적 퇴장. 진행 중인 게임에서는 자리(역할, 생존 여부)가 그대로 남는다.
     */
    public void leave(String rawCode, String rawClientId) {
        withRoom(rawCode, room -> {
            ClientId clientId = validator.requireClientId(rawClientId);
            RoomPlayer removed = room.removePlayer(clientId);
            if (removed == null) {
                return;
            }
            roomRegistry.unbindConnection(removed.getConnectionId(), room.getCode());
            log.info("[퇴장] room={}, clientId={}", room.getCode(), clientId);
            eventPublisher.publishRoomState(room);
            eventPublisher.publishHubState(room);
        });
    }

    // ==================== 조회 ====================

    public RoomStateResponse getRoomState(String rawCode) {
        String code = RoomCodeGenerator.normalize(rawCode);
        return lockStrategy.executeWithLock(Room.lockKey(code),
                () -> RoomStateResponse.from(roomRegistry.getRoom(code)));
    }

    public HubStateResponse getHubState(String rawCode) {
        String code = RoomCodeGenerator.normalize(rawCode);
        return lockStrategy.executeWithLock(Room.lockKey(code),
                () -> HubStateResponse.from(roomRegistry.getRoom(code)));
    }

    // ==================== 헬퍼 ====================

    /**
     * 플레이어의 연결을 새 연결로 바꾼다. 이전 연결은 잊는다.
     */
    void rebind(Room room, RoomPlayer player, String connectionId) {
        String previous = player.getConnectionId();
        if (previous != null && !previous.equals(connectionId)) {
            roomRegistry.unbindConnection(previous, room.getCode());
        }
        player.setConnectionId(connectionId);
        roomRegistry.bindConnection(connectionId, room.getCode());
    }

    static RoomPlayer requirePlayer(Room room, ClientId clientId) {
        RoomPlayer player = room.findPlayer(clientId);
        if (player == null) {
            throw ErrorCode.PLAYER_NOT_FOUND.commonException();
        }
        return player;
    }

    private void withRoom(String rawCode, Consumer<Room> action) {
        String code = RoomCodeGenerator.normalize(rawCode);
        lockStrategy.executeWithLock(Room.lockKey(code), () -> action.accept(roomRegistry.getRoom(code)));
    }
}
