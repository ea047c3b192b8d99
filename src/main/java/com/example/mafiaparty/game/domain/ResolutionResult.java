package com.example.mafiaparty.game.domain;

import com.example.mafiaparty.room.domain.ClientId;
import lombok.Builder;
import lombok.Getter;

/**
 * 마지막 밤/낮 처리 결과 (공개 정보)
 */
@Getter
@Builder
public class ResolutionResult {
    private final ResolutionType type;
    private final int round;
    private final ClientId died;        // NIGHT
    private final ClientId eliminated;  // DAY
    private final boolean tie;          // DAY

    public static ResolutionResult night(int round, ClientId died) {
        return ResolutionResult.builder()
                .type(ResolutionType.NIGHT)
                .round(round)
                .died(died)
                .build();
    }

    public static ResolutionResult day(int round, ClientId eliminated, boolean tie) {
        return ResolutionResult.builder()
                .type(ResolutionType.DAY)
                .round(round)
                .eliminated(eliminated)
                .tie(tie)
                .build();
    }
}
