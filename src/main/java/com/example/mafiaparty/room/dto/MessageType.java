package com.example.mafiaparty.room.dto;

public enum MessageType {
    ROOM_CREATED,
    PLAYER_JOINED,
    ROOM_STATE,
    HUB_STATE,
    GAME_STATE,
    ROLE_ASSIGNED,
    INVESTIGATION_RESULT,
    ROLES_REVEALED,
    ROOM_CLOSED,
    ERROR
}
