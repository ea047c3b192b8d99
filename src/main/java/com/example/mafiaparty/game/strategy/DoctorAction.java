package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.room.domain.ClientId;
import org.springframework.stereotype.Component;

/**
 * 의사 밤 행동 전략
 * - 타겟을 지목하여 마피아 공격으로부터 보호 (자기 자신 포함)
 */
@Component
public class DoctorAction implements RoleActionStrategy {

    @Override
    public PlayerRole getRole() {
        return PlayerRole.DOCTOR;
    }

    @Override
    public boolean canTarget(GameInstance game, ClientId actor, ClientId target) {
        return true;
    }

    @Override
    public NightActionResult execute(GameInstance game, ClientId actor, ClientId target) {
        return NightActionResult.builder()
                .actorRole(getRole())
                .actorId(actor)
                .targetId(target)
                .build();
    }
}
