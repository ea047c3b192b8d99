package com.example.mafiaparty.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    private final String code;
    private final ErrorCategory category;
    private final String message;
    private final Map<String, Object> details;

    public static ErrorResponse of(CommonException e) {
        return ErrorResponse.builder()
                .code(e.getErrorCode().getCode())
                .category(e.getErrorCode().getCategory())
                .message(e.getErrorCode().getMessage())
                .details(e.getDetails())
                .build();
    }
}
