package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.Team;
import com.example.mafiaparty.room.domain.ClientId;
import org.springframework.stereotype.Component;

/**
 * 탐정 밤 행동 전략
 * - 타겟을 지목하여 마피아 여부 확인. 자기 자신은 조사할 수 없다.
 */
@Component
public class DetectiveAction implements RoleActionStrategy {

    @Override
    public PlayerRole getRole() {
        return PlayerRole.DETECTIVE;
    }

    @Override
    public boolean canTarget(GameInstance game, ClientId actor, ClientId target) {
        return !actor.equals(target);
    }

    @Override
    public NightActionResult execute(GameInstance game, ClientId actor, ClientId target) {
        return NightActionResult.builder()
                .actorRole(getRole())
                .actorId(actor)
                .targetId(target)
                .targetIsMafia(game.roleOf(target).getTeam() == Team.MAFIA)
                .build();
    }
}
