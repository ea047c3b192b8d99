package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.room.domain.Room;
import org.springframework.stereotype.Component;

/**
 * 투표 결과 발표 페이즈 상태. 다음 밤으로 넘어가면서 라운드가 올라간다.
 */
@Component
public class ResolutionState implements GamePhaseState {

    @Override
    public void process(GameInstance game) {
    }

    @Override
    public void onExit(Room room, GameInstance game, PhaseResultProcessor processor) {
        game.nextRound();
    }

    @Override
    public GamePhase nextPhase(GameInstance game) {
        return GamePhase.NIGHT;
    }
}
