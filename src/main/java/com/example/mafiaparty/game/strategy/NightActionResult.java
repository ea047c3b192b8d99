package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.room.domain.ClientId;
import lombok.Builder;
import lombok.Getter;

/**
 * 밤 행동 결과 DTO
 */
@Getter
@Builder
public class NightActionResult {
    private final PlayerRole actorRole;
    private final ClientId actorId;
    private final ClientId targetId;
    private final boolean targetIsMafia; // 탐정 조사에서만 의미 있음
}
