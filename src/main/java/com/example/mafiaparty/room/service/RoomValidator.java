package com.example.mafiaparty.room.service;

import com.example.mafiaparty.global.config.PartyProperties;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 클라이언트가 보낸 식별자와 이름 검증
 */
@Component
@RequiredArgsConstructor
public class RoomValidator {

    public static final int MAX_CLIENT_ID_LENGTH = 64;

    private final PartyProperties properties;

    public ClientId requireClientId(String raw) {
        if (!StringUtils.hasText(raw)) {
            throw ErrorCode.CLIENT_ID_REQUIRED.commonException();
        }
        String value = raw.trim();
        // 잘라내면 서로 다른 식별자가 같은 자리로 합쳐진다
        if (value.length() > MAX_CLIENT_ID_LENGTH) {
            throw ErrorCode.CLIENT_ID_TOO_LONG.commonException();
        }
        return ClientId.of(value);
    }

    /**
     * 공백을 제거하고 최대 길이로 자른 표시 이름
     */
    public String requireName(String raw) {
        if (!StringUtils.hasText(raw)) {
            throw ErrorCode.NAME_REQUIRED.commonException();
        }
        String name = raw.trim();
        int max = properties.getRoom().getMaxNameLength();
        return name.length() > max ? name.substring(0, max).trim() : name;
    }

    /**
     * 호스트 전용 조작은 호스트 연결에서 온 것만 받는다.
     */
    public void requireHost(Room room, String connectionId) {
        if (!room.isHostConnection(connectionId)) {
            throw ErrorCode.NOT_HOST.commonException();
        }
    }
}
