package com.example.mafiaparty.global.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * party.* 설정값 (application.yml)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "party")
public class PartyProperties {

    private Room room = new Room();
    private Game game = new Game();

    @Getter
    @Setter
    public static class Room {
        /** 호스트 연결이 끊긴 뒤 방을 유지하는 시간(초). 0이면 즉시 방을 닫는다. */
        private int hostGraceSeconds = 90;
        private int codeLength = 4;
        private int fallbackCodeLength = 6;
        /** 기본 길이 코드가 연속으로 충돌할 때 긴 코드로 넘어가기 전까지의 시도 횟수 */
        private int codeAttempts = 64;
        private int maxNameLength = 24;
    }

    @Getter
    @Setter
    public static class Game {
        private int minPlayers = 5;
        private int devMinPlayers = 2;
        private int pointsPerWin = 1;
    }
}
