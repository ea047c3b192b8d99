package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.room.domain.Room;

/**
 * 게임 페이즈 상태 인터페이스 (State Pattern)
 */
public interface GamePhaseState {

    /**
     * 현재 페이즈 진입 시 처리
     */
    void process(GameInstance game);

    /**
     * 현재 페이즈 종료 시 결과 처리 (투표 집계, 밤 행동 처리 등)
     * advancePhase 에서 다음 페이즈로 넘어가기 전에 호출됨
     *
     * @param room      게임이 속한 방 (점수/히스토리 반영용)
     * @param game      게임 상태
     * @param processor 결과 처리를 위임할 프로세서
     */
    void onExit(Room room, GameInstance game, PhaseResultProcessor processor);

    /**
     * 다음 페이즈. onExit 에서 게임이 끝났다면 호출되지 않는다.
     */
    GamePhase nextPhase(GameInstance game);
}
