package com.example.mafiaparty.game.strategy;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.room.domain.ClientId;

/**
 * 역할별 밤 행동 전략 인터페이스 (Strategy Pattern)
 */
public interface RoleActionStrategy {

    PlayerRole getRole();

    /**
     * 역할 고유의 대상 제한. 생존 여부는 호출 전에 이미 확인된 상태다.
     */
    boolean canTarget(GameInstance game, ClientId actor, ClientId target);

    /**
     * 밤 행동 실행
     *
     * @param game   현재 게임 상태
     * @param actor  행동 주체
     * @param target 행동 대상
     * @return 행동 결과 (마피아 타겟, 의사 보호 대상, 탐정 조사 결과)
     */
    NightActionResult execute(GameInstance game, ClientId actor, ClientId target);
}
