package com.example.mafiaparty.global.error;

import lombok.Getter;

import java.util.Map;

@Getter
public class CommonException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public CommonException(ErrorCode errorCode) {
        this(errorCode, Map.of());
    }

    public CommonException(ErrorCode errorCode, Map<String, Object> details) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = details;
    }
}
