package com.example.mafiaparty.room.service;

import com.example.mafiaparty.room.dto.RoomMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class StompRoomBroadcaster implements RoomBroadcaster {

    public static final String ROOM_TOPIC_PREFIX = "/topic/room.";
    public static final String PRIVATE_QUEUE = "/queue/private";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void broadcastToRoom(String roomCode, RoomMessage message) {
        try {
            messagingTemplate.convertAndSend(ROOM_TOPIC_PREFIX + roomCode, message);
        } catch (Exception e) {
            log.error("방 메시지 전송 실패: room={}, type={}, error: {}", roomCode, message.getType(), e.getMessage());
        }
    }

    /**
     * 인증 사용자가 없으므로 STOMP 세션 id 자체를 user 로 사용한다.
     * 클라이언트는 /user/queue/private 를 구독한다.
     */
    @Override
    public void sendToConnection(String connectionId, RoomMessage message) {
        if (connectionId == null) {
            return;
        }
        try {
            messagingTemplate.convertAndSendToUser(connectionId, PRIVATE_QUEUE, message, sessionHeaders(connectionId));
        } catch (Exception e) {
            log.error("개인 메시지 전송 실패: connection={}, type={}, error: {}", connectionId, message.getType(),
                    e.getMessage());
        }
    }

    private MessageHeaders sessionHeaders(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
