package com.example.mafiaparty.room.service;

import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 살아있는 방 목록 (메모리). 방 코드는 방이 살아있는 동안 유일하다.
 * 연결 id → 방 코드 색인도 함께 관리해서 연결 해제 시 방을 바로 찾는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoomRegistry {

    private final RoomCodeGenerator codeGenerator;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, String> connectionRooms = new ConcurrentHashMap<>();

    public Room create(ClientId hostId, String hostConnection) {
        Room room;
        do {
            String code = codeGenerator.generate(rooms::containsKey);
            room = new Room(code, hostId, hostConnection, Instant.now());
        } while (rooms.putIfAbsent(room.getCode(), room) != null);

        bindConnection(hostConnection, room.getCode());
        log.info("[방생성] room={}, host={}, rooms={}", room.getCode(), hostId, rooms.size());
        return room;
    }

    public Optional<Room> find(String rawCode) {
        String code = RoomCodeGenerator.normalize(rawCode);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(code));
    }

    public Room getRoom(String rawCode) {
        return find(rawCode).orElseThrow(ErrorCode.ROOM_NOT_FOUND::commonException);
    }

    public List<Room> findByHost(ClientId hostId) {
        return rooms.values().stream()
                .filter(room -> room.isHost(hostId))
                .toList();
    }

    public Room remove(String code) {
        Room removed = rooms.remove(code);
        if (removed != null) {
            connectionRooms.values().removeIf(code::equals);
            log.info("[방삭제] room={}, rooms={}", code, rooms.size());
        }
        return removed;
    }

    public boolean exists(String code) {
        return rooms.containsKey(code);
    }

    // --- 연결 색인 ---

    public void bindConnection(String connectionId, String code) {
        if (connectionId != null) {
            connectionRooms.put(connectionId, code);
        }
    }

    public String unbindConnection(String connectionId) {
        return connectionId == null ? null : connectionRooms.remove(connectionId);
    }

    public void unbindConnection(String connectionId, String code) {
        if (connectionId != null) {
            connectionRooms.remove(connectionId, code);
        }
    }
}
