package com.example.mafiaparty.game.domain;

import com.example.mafiaparty.room.domain.ClientId;

/**
 * 탐정 조사 결과. 조사한 탐정 본인에게만 보인다.
 */
public record Investigation(int round, ClientId targetId, String targetName, boolean mafia) {
}
