package com.example.mafiaparty.game.service;

import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.room.domain.ClientId;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Component
public class RoleAssigner {

    private final Random random;

    public RoleAssigner() {
        this(new SecureRandom());
    }

    public RoleAssigner(Random random) {
        this.random = random;
    }

    /**
     * 참가자 순서대로 역할을 한 개씩 배정한다.
     */
    public Map<ClientId, PlayerRole> assignRoles(List<ClientId> players) {
        List<PlayerRole> roles = distributeRoles(players.size());
        Collections.shuffle(roles, random);

        Map<ClientId, PlayerRole> assignment = new LinkedHashMap<>();
        for (int i = 0; i < players.size(); i++) {
            assignment.put(players.get(i), roles.get(i));
        }
        return assignment;
    }

    /**
     * 3명 이하는 마피아 1명, 그 이상은 (n-1)/3 명 (최소 1명)
     */
    public static int mafiaCount(int playerCount) {
        if (playerCount <= 3) {
            return 1;
        }
        return Math.max(1, (playerCount - 1) / 3);
    }

    List<PlayerRole> distributeRoles(int playerCount) {
        List<PlayerRole> roles = new ArrayList<>();
        int mafiaCount = Math.min(mafiaCount(playerCount), playerCount);

        for (int i = 0; i < mafiaCount; i++) {
            roles.add(PlayerRole.MAFIA);
        }
        if (playerCount >= 3) {
            if (roles.size() < playerCount) {
                roles.add(PlayerRole.DETECTIVE);
            }
            if (roles.size() < playerCount) {
                roles.add(PlayerRole.DOCTOR);
            }
        }
        while (roles.size() < playerCount) {
            roles.add(PlayerRole.VILLAGER);
        }
        return roles;
    }
}
