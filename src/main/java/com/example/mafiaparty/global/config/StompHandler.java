package com.example.mafiaparty.global.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * CONNECT 프레임의 clientId 헤더를 세션 속성에 저장한다.
 * 인증은 없고, 페이로드에 clientId가 빠졌을 때 기본값으로만 쓰인다.
 */
@Component
@Slf4j
public class StompHandler implements ChannelInterceptor {

    public static final String CLIENT_ID_HEADER = "clientId";
    public static final String CLIENT_ID_ATTRIBUTE = "clientId";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            String clientId = accessor.getFirstNativeHeader(CLIENT_ID_HEADER);
            Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
            if (StringUtils.hasText(clientId) && sessionAttributes != null) {
                sessionAttributes.put(CLIENT_ID_ATTRIBUTE, clientId.trim());
                log.debug("StompHandler: 세션 {} 에 clientId '{}' 저장", accessor.getSessionId(), clientId);
            }
        }
        return message;
    }

    /**
     * 페이로드 값이 있으면 그것을, 없으면 CONNECT 때 받은 clientId를 돌려준다.
     */
    public static String resolveClientId(String fromPayload, SimpMessageHeaderAccessor accessor) {
        if (StringUtils.hasText(fromPayload)) {
            return fromPayload;
        }
        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        if (sessionAttributes != null && sessionAttributes.get(CLIENT_ID_ATTRIBUTE) instanceof String) {
            return (String) sessionAttributes.get(CLIENT_ID_ATTRIBUTE);
        }
        return null;
    }
}
