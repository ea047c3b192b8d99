package com.example.mafiaparty.room.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 서버 → 클라이언트 메시지 공통 외형
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomMessage {

    private MessageType type;
    private String roomCode;
    private Object payload;
    private long timestamp;

    public static RoomMessage of(MessageType type, String roomCode, Object payload) {
        return RoomMessage.builder()
                .type(type)
                .roomCode(roomCode)
                .payload(payload)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
