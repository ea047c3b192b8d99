package com.example.mafiaparty.room.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Builder
public class RoomPlayer {

    private final ClientId clientId;

    private String displayName;

    @Builder.Default
    private boolean ready = false;

    // 연결이 끊기면 null. 플레이어 자체는 방에 남는다.
    private String connectionId;

    @Builder.Default
    private int score = 0;

    public boolean isConnected() {
        return connectionId != null;
    }

    public void addScore(int points) {
        this.score += points;
    }
}
