package com.example.mafiaparty.game.state;

import com.example.mafiaparty.game.domain.GamePhase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class GamePhaseFactory {

    private final RoleRevealState roleRevealState;
    private final NightState nightState;
    private final DayDiscussionState dayDiscussionState;
    private final VoteState voteState;
    private final ResolutionState resolutionState;

    /**
     * 현재 페이즈에 맞는 상태 객체 반환. LOBBY/ENDED 는 진행할 상태가 없으므로 null.
     */
    public GamePhaseState getState(GamePhase phase) {
        return switch (phase) {
            case ROLE_REVEAL -> roleRevealState;
            case NIGHT -> nightState;
            case DAY_DISCUSSION -> dayDiscussionState;
            case VOTE -> voteState;
            case RESOLUTION -> resolutionState;
            case LOBBY, ENDED -> null;
        };
    }
}
