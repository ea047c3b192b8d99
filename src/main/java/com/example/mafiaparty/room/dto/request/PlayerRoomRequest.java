package com.example.mafiaparty.room.dto.request;

/**
 * 방 코드와 플레이어 식별자만 필요한 요청 (재연결, 퇴장, 게임 화면 조회)
 */
public record PlayerRoomRequest(String roomCode, String clientId) {
}
