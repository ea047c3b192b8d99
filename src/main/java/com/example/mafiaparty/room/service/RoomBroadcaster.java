package com.example.mafiaparty.room.service;

import com.example.mafiaparty.room.dto.RoomMessage;

/**
 * 방 이벤트 전달 통로. 운영에서는 STOMP, 테스트에서는 기록용 구현을 쓴다.
 */
public interface RoomBroadcaster {

    /**
     * 방을 구독 중인 모든 연결에게 공개 메시지 전송
     */
    void broadcastToRoom(String roomCode, RoomMessage message);

    /**
     * 특정 연결 하나에게만 메시지 전송
     */
    void sendToConnection(String connectionId, RoomMessage message);
}
