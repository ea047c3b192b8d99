package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.room.domain.Room;
import org.springframework.stereotype.Component;

/**
 * 낮 투표 페이즈 상태
 */
@Component
public class VoteState implements GamePhaseState {

    @Override
    public void process(GameInstance game) {
        game.clearVotes();
    }

    @Override
    public void onExit(Room room, GameInstance game, PhaseResultProcessor processor) {
        processor.processDayVoting(room, game);
    }

    @Override
    public GamePhase nextPhase(GameInstance game) {
        return GamePhase.RESOLUTION;
    }
}
