package com.example.mafiaparty.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Room not found"),
    PLAYER_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Player is not part of this room"),
    NOT_HOST(HttpStatus.FORBIDDEN, ErrorCategory.AUTHORIZATION, "Only the host can do that"),
    DEV_MODE_REQUIRED(HttpStatus.FORBIDDEN, ErrorCategory.AUTHORIZATION, "Dev mode is off", true),
    NAME_REQUIRED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Name is required"),
    CLIENT_ID_REQUIRED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Client id is required"),
    CLIENT_ID_TOO_LONG(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Client id is too long"),
    NAME_ALREADY_TAKEN(HttpStatus.CONFLICT, ErrorCategory.VALIDATION, "Name is already taken"),
    UNKNOWN_GAME(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Unknown game"),
    INVALID_ROLE(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Unknown role", true),
    NEED_MIN_PLAYERS(HttpStatus.CONFLICT, ErrorCategory.PRECONDITION, "Not enough players"),
    NOT_ALL_READY(HttpStatus.CONFLICT, ErrorCategory.PRECONDITION, "Not every player is ready"),
    GAME_IN_PROGRESS(HttpStatus.CONFLICT, ErrorCategory.PRECONDITION, "A game is already running"),
    INVALID_ACTION(HttpStatus.CONFLICT, ErrorCategory.PRECONDITION, "Action not allowed right now"),
    ;

    private final HttpStatus status;
    private final ErrorCategory category;
    private final String message;
    // silent 코드는 호출자에게 알리지 않고 버린다
    private final boolean silent;

    ErrorCode(HttpStatus status, ErrorCategory category, String message) {
        this(status, category, message, false);
    }

    ErrorCode(HttpStatus status, ErrorCategory category, String message, boolean silent) {
        this.status = status;
        this.category = category;
        this.message = message;
        this.silent = silent;
    }

    public String getCode() {
        return name();
    }

    public CommonException commonException() {
        return new CommonException(this);
    }
}
