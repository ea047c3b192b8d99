package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.room.domain.Room;
import org.springframework.stereotype.Component;

/**
 * 밤 행동 페이즈 상태
 */
@Component
public class NightState implements GamePhaseState {

    @Override
    public void process(GameInstance game) {
        game.clearNightSelections();
    }

    @Override
    public void onExit(Room room, GameInstance game, PhaseResultProcessor processor) {
        processor.processNight(room, game);
    }

    @Override
    public GamePhase nextPhase(GameInstance game) {
        return GamePhase.DAY_DISCUSSION;
    }
}
