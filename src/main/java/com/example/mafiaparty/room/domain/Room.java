package com.example.mafiaparty.room.domain;

import com.example.mafiaparty.game.domain.GameInstance;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 방 코드 하나로 묶인 세션. 호스트 한 명과 여러 플레이어, 그리고 최대 한 개의 진행 중인 게임을 가진다.
 * 모든 변경은 방 단위 락 안에서만 일어난다.
 */
@Getter
public class Room {

    public static final String DEFAULT_GAME = "mafia";
    private static final String LOCK_PREFIX = "room:";

    private final String code;
    private final ClientId hostId;
    private final Instant createdAt;

    @Setter
    private String hostConnection;

    @Setter
    private boolean devMode;

    @Setter
    private String currentGame = DEFAULT_GAME;

    @Setter
    private GameInstance game;

    private final Map<ClientId, RoomPlayer> players = new LinkedHashMap<>();
    private final List<GameRecord> history = new ArrayList<>();

    public Room(String code, ClientId hostId, String hostConnection, Instant createdAt) {
        this.code = code;
        this.hostId = hostId;
        this.hostConnection = hostConnection;
        this.createdAt = createdAt;
    }

    public static String lockKey(String code) {
        return LOCK_PREFIX + code;
    }

    public boolean isHost(ClientId clientId) {
        return hostId.equals(clientId);
    }

    public boolean isHostConnection(String connectionId) {
        return connectionId != null && connectionId.equals(hostConnection);
    }

    public RoomPlayer findPlayer(ClientId clientId) {
        return players.get(clientId);
    }

    public Optional<RoomPlayer> findPlayerByConnection(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return players.values().stream()
                .filter(p -> connectionId.equals(p.getConnectionId()))
                .findFirst();
    }

    public Collection<RoomPlayer> getPlayerList() {
        return Collections.unmodifiableCollection(players.values());
    }

    public void addPlayer(RoomPlayer player) {
        players.put(player.getClientId(), player);
    }

    public RoomPlayer removePlayer(ClientId clientId) {
        return players.remove(clientId);
    }

    public boolean isNameTaken(String displayName, ClientId except) {
        return players.values().stream()
                .anyMatch(p -> !p.getClientId().equals(except) && p.getDisplayName().equalsIgnoreCase(displayName));
    }

    public boolean allReady() {
        return !players.isEmpty() && players.values().stream().allMatch(RoomPlayer::isReady);
    }

    public void resetReady() {
        players.values().forEach(p -> p.setReady(false));
    }

    public boolean hasRunningGame() {
        return game != null && !game.isEnded();
    }

    public void addHistory(GameRecord record) {
        history.add(record);
    }
}
