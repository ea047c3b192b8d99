package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.PlayerRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 역할별 전략을 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class RoleActionFactory {

    private final MafiaAction mafiaAction;
    private final DoctorAction doctorAction;
    private final DetectiveAction detectiveAction;

    /**
     * 역할에 맞는 전략 반환
     */
    public RoleActionStrategy getStrategy(PlayerRole role) {
        return switch (role) {
            case MAFIA -> mafiaAction;
            case DOCTOR -> doctorAction;
            case DETECTIVE -> detectiveAction;
            case VILLAGER -> null; // 시민은 밤 행동 없음
        };
    }
}
