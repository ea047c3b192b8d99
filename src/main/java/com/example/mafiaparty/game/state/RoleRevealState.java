package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.room.domain.Room;
import org.springframework.stereotype.Component;

/**
 * 역할 확인 페이즈 상태
 */
@Component
public class RoleRevealState implements GamePhaseState {

    @Override
    public void process(GameInstance game) {
        // 역할 배정은 게임 생성 시 끝난다
    }

    @Override
    public void onExit(Room room, GameInstance game, PhaseResultProcessor processor) {
    }

    @Override
    public GamePhase nextPhase(GameInstance game) {
        return GamePhase.NIGHT;
    }
}
