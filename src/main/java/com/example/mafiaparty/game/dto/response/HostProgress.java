package com.example.mafiaparty.game.dto.response;

/**
 * 호스트 화면용 진행 현황. 누가 무엇을 골랐는지는 담지 않는다.
 */
public record HostProgress(
        int nightActionsSubmitted,
        int nightActionsExpected,
        int votesCast,
        int votesExpected
) {
}
