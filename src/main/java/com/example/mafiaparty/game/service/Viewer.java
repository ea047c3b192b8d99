package com.example.mafiaparty.game.service;

import com.example.mafiaparty.room.domain.ClientId;

/**
 * 게임 화면을 보는 주체. 호스트 화면이거나 특정 플레이어.
 */
public record Viewer(ClientId clientId, boolean host) {

    public static Viewer host(ClientId hostId) {
        return new Viewer(hostId, true);
    }

    public static Viewer player(ClientId clientId) {
        return new Viewer(clientId, false);
    }
}
