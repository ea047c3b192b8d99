package com.example.mafiaparty.global.error;

import com.example.mafiaparty.room.service.RoomEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.web.bind.annotation.ControllerAdvice;

/**
 * STOMP 핸들러에서 던진 예외를 호출한 연결에게만 ERROR 메시지로 돌려준다.
 * silent 코드는 로그만 남기고 버린다.
 */
@Slf4j
@ControllerAdvice
@RequiredArgsConstructor
public class GlobalMessageExceptionHandler {

    private final RoomEventPublisher eventPublisher;

    @MessageExceptionHandler(CommonException.class)
    public void handleCommonException(CommonException e, SimpMessageHeaderAccessor accessor) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.isSilent()) {
            log.debug("무시된 요청: session={}, code={}", accessor.getSessionId(), errorCode.getCode());
            return;
        }
        log.debug("요청 거부: session={}, code={}", accessor.getSessionId(), errorCode.getCode());
        eventPublisher.sendError(accessor.getSessionId(), ErrorResponse.of(e));
    }

    @MessageExceptionHandler(Exception.class)
    public void handleException(Exception e, SimpMessageHeaderAccessor accessor) {
        log.error("STOMP 처리 중 예상치 못한 오류: session={}", accessor.getSessionId(), e);
        eventPublisher.sendError(accessor.getSessionId(), ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("Unexpected server error")
                .build());
    }
}
