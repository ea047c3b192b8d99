package com.example.mafiaparty.room.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.Investigation;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.dto.response.RoleAssignment;
import com.example.mafiaparty.game.dto.response.RoleRevealEntry;
import com.example.mafiaparty.game.service.GameViewProjector;
import com.example.mafiaparty.game.service.Viewer;
import com.example.mafiaparty.global.error.ErrorResponse;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.CloseReason;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.room.dto.RoomMessage;
import com.example.mafiaparty.room.dto.response.HubStateResponse;
import com.example.mafiaparty.room.dto.response.RoomStateResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 방/게임 이벤트를 메시지로 만들어 알맞은 연결에 보낸다.
 * 항상 방 락 안에서 호출되므로 같은 방의 메시지 순서가 유지된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoomEventPublisher {

    private final RoomBroadcaster broadcaster;
    private final GameViewProjector projector;

    // ================== 공개 메시지 ================== //

    public void publishRoomState(Room room) {
        broadcaster.broadcastToRoom(room.getCode(),
                RoomMessage.of(MessageType.ROOM_STATE, room.getCode(), RoomStateResponse.from(room)));
    }

    public void publishHubState(Room room) {
        broadcaster.broadcastToRoom(room.getCode(),
                RoomMessage.of(MessageType.HUB_STATE, room.getCode(), HubStateResponse.from(room)));
    }

    public void publishRoomClosed(String roomCode, CloseReason reason) {
        broadcaster.broadcastToRoom(roomCode,
                RoomMessage.of(MessageType.ROOM_CLOSED, roomCode, Map.of("reason", reason)));
    }

    /**
     * 방 상태, 허브 상태, 시청자별 게임 화면을 모두 다시 보낸다.
     */
    public void publishAll(Room room) {
        publishRoomState(room);
        publishHubState(room);
        publishGameViews(room);
    }

    // ================== 개인 메시지 ================== //

    /**
     * 호스트 화면과 연결된 각 플레이어에게 각자의 게임 화면을 보낸다.
     */
    public void publishGameViews(Room room) {
        if (room.getGame() == null) {
            return;
        }
        sendHostView(room);
        for (RoomPlayer player : room.getPlayerList()) {
            sendPlayerView(room, player);
        }
    }

    public void sendHostView(Room room) {
        send(room.getHostConnection(), MessageType.GAME_STATE, room.getCode(),
                projector.project(room, Viewer.host(room.getHostId())));
    }

    public void sendPlayerView(Room room, RoomPlayer player) {
        if (!player.isConnected()) {
            return;
        }
        send(player.getConnectionId(), MessageType.GAME_STATE, room.getCode(),
                projector.project(room, Viewer.player(player.getClientId())));
    }

    public void sendRoleAssignment(Room room, ClientId clientId) {
        GameInstance game = room.getGame();
        RoomPlayer player = room.findPlayer(clientId);
        if (game == null || player == null || !game.isParticipant(clientId)) {
            return;
        }
        PlayerRole role = game.roleOf(clientId);
        send(player.getConnectionId(), MessageType.ROLE_ASSIGNED, room.getCode(), RoleAssignment.of(role));
    }

    public void sendInvestigation(Room room, ClientId detectiveId, Investigation investigation) {
        RoomPlayer detective = room.findPlayer(detectiveId);
        if (detective == null) {
            return;
        }
        send(detective.getConnectionId(), MessageType.INVESTIGATION_RESULT, room.getCode(), investigation);
    }

    public void sendRolesRevealed(Room room, List<RoleRevealEntry> entries) {
        send(room.getHostConnection(), MessageType.ROLES_REVEALED, room.getCode(), entries);
    }

    public void sendToConnection(String connectionId, MessageType type, String roomCode, Object payload) {
        send(connectionId, type, roomCode, payload);
    }

    public void sendError(String connectionId, ErrorResponse error) {
        send(connectionId, MessageType.ERROR, null, error);
    }

    // ================== 재접속 동기화 ================== //

    /**
     * 호스트 화면 전체 동기화. 호스트 연결에만 보낸다.
     */
    public void resyncHost(Room room) {
        String connection = room.getHostConnection();
        send(connection, MessageType.ROOM_STATE, room.getCode(), RoomStateResponse.from(room));
        send(connection, MessageType.HUB_STATE, room.getCode(), HubStateResponse.from(room));
        if (room.getGame() != null) {
            sendHostView(room);
        }
    }

    /**
     * 플레이어 한 명의 전체 동기화. 그 플레이어의 역할과 조사 결과는 그 연결에만 간다.
     */
    public void resyncPlayer(Room room, RoomPlayer player) {
        String connection = player.getConnectionId();
        send(connection, MessageType.ROOM_STATE, room.getCode(), RoomStateResponse.from(room));
        send(connection, MessageType.HUB_STATE, room.getCode(), HubStateResponse.from(room));
        if (room.getGame() != null) {
            sendRoleAssignment(room, player.getClientId());
            sendPlayerView(room, player);
        }
    }

    private void send(String connectionId, MessageType type, String roomCode, Object payload) {
        if (connectionId == null) {
            log.debug("연결이 없어 메시지 생략: room={}, type={}", roomCode, type);
            return;
        }
        broadcaster.sendToConnection(connectionId, RoomMessage.of(type, roomCode, payload));
    }
}
