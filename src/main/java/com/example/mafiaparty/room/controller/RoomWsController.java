package com.example.mafiaparty.room.controller;

import com.example.mafiaparty.global.config.StompHandler;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.room.dto.request.AttachHostRequest;
import com.example.mafiaparty.room.dto.request.CreateRoomRequest;
import com.example.mafiaparty.room.dto.request.CurrentGameRequest;
import com.example.mafiaparty.room.dto.request.DevModeRequest;
import com.example.mafiaparty.room.dto.request.JoinRoomRequest;
import com.example.mafiaparty.room.dto.request.PlayerRoomRequest;
import com.example.mafiaparty.room.dto.request.ReadyRequest;
import com.example.mafiaparty.room.dto.request.RoomCodeRequest;
import com.example.mafiaparty.room.dto.response.HubStateResponse;
import com.example.mafiaparty.room.dto.response.RoomStateResponse;
import com.example.mafiaparty.room.service.PresenceService;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import com.example.mafiaparty.room.service.RoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * 방/플레이어 생명주기 STOMP 엔드포인트. 연결 id 는 STOMP 세션 id 를 쓴다.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class RoomWsController {

    private final RoomService roomService;
    private final PresenceService presenceService;
    private final RoomEventPublisher eventPublisher;

    // ==================== 호스트 ====================

    @MessageMapping("/host.createRoom")
    public void createRoom(@Payload(required = false) CreateRoomRequest request, SimpMessageHeaderAccessor accessor) {
        String hostId = StompHandler.resolveClientId(request != null ? request.hostId() : null, accessor);
        roomService.createRoom(hostId, accessor.getSessionId());
    }

    @MessageMapping("/host.attach")
    public void attachHost(@Payload AttachHostRequest request, SimpMessageHeaderAccessor accessor) {
        String hostId = StompHandler.resolveClientId(request.hostId(), accessor);
        presenceService.attachHost(request.roomCode(), hostId, accessor.getSessionId());
    }

    @MessageMapping("/host.devMode")
    public void setDevMode(@Payload DevModeRequest request, SimpMessageHeaderAccessor accessor) {
        roomService.setDevMode(request.roomCode(), request.enabled(), accessor.getSessionId());
    }

    @MessageMapping("/host.currentGame")
    public void setCurrentGame(@Payload CurrentGameRequest request, SimpMessageHeaderAccessor accessor) {
        roomService.setCurrentGame(request.roomCode(), request.gameKey(), accessor.getSessionId());
    }

    // ==================== 플레이어 ====================

    @MessageMapping("/player.join")
    public void join(@Payload JoinRoomRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        roomService.join(request.roomCode(), clientId, request.name(), accessor.getSessionId());
    }

    @MessageMapping("/player.attach")
    public void attachPlayer(@Payload PlayerRoomRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        presenceService.attachPlayer(request.roomCode(), clientId, accessor.getSessionId());
    }

    @MessageMapping("/player.ready")
    public void ready(@Payload ReadyRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        roomService.setReady(request.roomCode(), clientId, request.ready());
    }

    @MessageMapping("/player.leave")
    public void leave(@Payload PlayerRoomRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        roomService.leave(request.roomCode(), clientId);
    }

    // ==================== 조회 ====================

    @MessageMapping("/room.getState")
    public void getState(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        RoomStateResponse state = roomService.getRoomState(request.roomCode());
        eventPublisher.sendToConnection(accessor.getSessionId(), MessageType.ROOM_STATE, state.roomCode(), state);
    }

    @MessageMapping("/room.getHub")
    public void getHub(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        HubStateResponse hub = roomService.getHubState(request.roomCode());
        eventPublisher.sendToConnection(accessor.getSessionId(), MessageType.HUB_STATE, hub.roomCode(), hub);
    }

    /**
     * WebSocket 연결 해제 이벤트 처리
     */
    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        log.debug("WebSocket 연결 해제됨: {}", event.getSessionId());
        presenceService.detach(event.getSessionId());
    }
}
