package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.Team;
import com.example.mafiaparty.room.domain.ClientId;
import org.springframework.stereotype.Component;

/**
 * 마피아 밤 행동 전략
 * - 타겟을 지목하여 제거 투표. 자신과 다른 마피아는 지목할 수 없다.
 */
@Component
public class MafiaAction implements RoleActionStrategy {

    @Override
    public PlayerRole getRole() {
        return PlayerRole.MAFIA;
    }

    @Override
    public boolean canTarget(GameInstance game, ClientId actor, ClientId target) {
        return game.roleOf(target).getTeam() != Team.MAFIA;
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
