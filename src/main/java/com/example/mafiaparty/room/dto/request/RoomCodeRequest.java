package com.example.mafiaparty.room.dto.request;

/**
 * 방 코드만 필요한 요청 (게임 시작, 페이즈 진행, 상태 조회 등)
 */
public record RoomCodeRequest(String roomCode) {
}
