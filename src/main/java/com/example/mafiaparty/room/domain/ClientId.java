package com.example.mafiaparty.room.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * 클라이언트가 보내는 불투명 식별자. 재접속해도 바뀌지 않는다.
 */
public record ClientId(String value) {

    public ClientId {
        Objects.requireNonNull(value, "value");
    }

    public static ClientId of(String value) {
        return new ClientId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
