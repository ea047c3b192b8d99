package com.example.mafiaparty.game.controller;

import com.example.mafiaparty.game.dto.request.NightActionRequest;
import com.example.mafiaparty.game.dto.request.VoteRequest;
import com.example.mafiaparty.game.dto.response.GameView;
import com.example.mafiaparty.game.service.GameService;
import com.example.mafiaparty.global.config.StompHandler;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.room.dto.request.PlayerRoomRequest;
import com.example.mafiaparty.room.dto.request.RoomCodeRequest;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
public class GameWsController {

    private final GameService gameService;
    private final RoomEventPublisher eventPublisher;

    // ==================== 호스트 ====================

    @MessageMapping("/host.startGame")
    public void startGame(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        gameService.startGame(request.roomCode(), accessor.getSessionId());
    }

    @MessageMapping("/host.advance")
    public void advance(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        gameService.advancePhase(request.roomCode(), accessor.getSessionId());
    }

    @MessageMapping("/host.forceResolveNight")
    public void forceResolveNight(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        gameService.forceResolveNight(request.roomCode(), accessor.getSessionId());
    }

    @MessageMapping("/host.forceResolveDay")
    public void forceResolveDay(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        gameService.forceResolveDay(request.roomCode(), accessor.getSessionId());
    }

    @MessageMapping("/host.backToLobby")
    public void backToLobby(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        gameService.backToLobby(request.roomCode(), accessor.getSessionId());
    }

    // ==================== 플레이어 ====================

    @MessageMapping("/game.nightAction")
    public void nightAction(@Payload NightActionRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        gameService.submitNightAction(request.roomCode(), clientId, request.action(), request.targetId());
    }

    @MessageMapping("/game.vote")
    public void vote(@Payload VoteRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        gameService.submitVote(request.roomCode(), clientId, request.targetId());
    }

    /**
     * 호출한 연결에게만 현재 게임 화면을 보낸다.
     */
    @MessageMapping("/game.getState")
    public void getState(@Payload PlayerRoomRequest request, SimpMessageHeaderAccessor accessor) {
        String clientId = StompHandler.resolveClientId(request.clientId(), accessor);
        GameView view = gameService.getGameView(request.roomCode(), clientId, accessor.getSessionId());
        eventPublisher.sendToConnection(accessor.getSessionId(), MessageType.GAME_STATE, view.getRoomCode(), view);
    }
}
