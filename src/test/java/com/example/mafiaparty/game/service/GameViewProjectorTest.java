package com.example.mafiaparty.game.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.GamePhase;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.domain.Team;
import com.example.mafiaparty.game.dto.response.GameView;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GameViewProjectorTest {

    private static final ClientId MAFIA = ClientId.of("m1");
    private static final ClientId DETECTIVE = ClientId.of("det");
    private static final ClientId VILLAGER = ClientId.of("v1");

    private final GameViewProjector projector = new GameViewProjector();
    private Room room;
    private GameInstance game;

    @BeforeEach
    void setUp() {
        room = new Room("ABCD", ClientId.of("host"), "host-conn", Instant.now());
        Map<ClientId, String> names = new LinkedHashMap<>();
        names.put(MAFIA, "Mona");
        names.put(DETECTIVE, "Dan");
        names.put(VILLAGER, "Vera");
        Map<ClientId, PlayerRole> roles = new LinkedHashMap<>();
        roles.put(MAFIA, PlayerRole.MAFIA);
        roles.put(DETECTIVE, PlayerRole.DETECTIVE);
        roles.put(VILLAGER, PlayerRole.VILLAGER);
        game = new GameInstance("mafia", names, roles, Instant.now());
        game.moveTo(GamePhase.NIGHT);
        game.recordNightSelection(MAFIA, VILLAGER);
        room.setGame(game);
    }

    @Test
    @DisplayName("플레이어는 자기 역할과 자기 밤 대상만 본다")
    void playerSeesOnlyOwnPrivateState() {
        GameView view = projector.project(room, Viewer.player(MAFIA));

        assertThat(view.getSelf().role()).isEqualTo(PlayerRole.MAFIA);
        assertThat(view.getSelf().team()).isEqualTo(Team.MAFIA);
        assertThat(view.getSelf().nightTarget()).isEqualTo(VILLAGER);
        assertThat(view.getProgress()).isNull();

        GameView other = projector.project(room, Viewer.player(VILLAGER));
        assertThat(other.getSelf().role()).isEqualTo(PlayerRole.VILLAGER);
        assertThat(other.getSelf().nightTarget()).isNull();
    }

    @Test
    @DisplayName("직렬화된 화면에 다른 플레이어의 역할이 나타나지 않는다")
    void serializedViewNeverLeaksOtherRoles() throws Exception {
        String json = new ObjectMapper().writeValueAsString(projector.project(room, Viewer.player(VILLAGER)));

        assertThat(json).contains("VILLAGER");
        assertThat(json).doesNotContain("\"MAFIA\"", "DETECTIVE");
    }

    @Test
    @DisplayName("호스트 화면은 제출 수만 보여주고 역할이나 대상은 없다")
    void hostSeesCountsOnly() throws Exception {
        GameView view = projector.project(room, Viewer.host(room.getHostId()));

        assertThat(view.getSelf()).isNull();
        assertThat(view.getProgress().nightActionsSubmitted()).isEqualTo(1);
        assertThat(view.getProgress().nightActionsExpected()).isEqualTo(2);
        assertThat(view.getProgress().votesExpected()).isEqualTo(3);

        String json = new ObjectMapper().writeValueAsString(view);
        assertThat(json).doesNotContain("MAFIA", "DETECTIVE", "VILLAGER");
    }

    @Test
    @DisplayName("게임에 참가하지 않은 플레이어는 공개 정보만 본다")
    void nonParticipantSeesPublicView() {
        GameView view = projector.project(room, Viewer.player(ClientId.of("late")));

        assertThat(view.getSelf()).isNull();
        assertThat(view.getRoster()).hasSize(3);
        assertThat(view.getPhase()).isEqualTo(GamePhase.NIGHT);
    }

    @Test
    @DisplayName("게임이 없으면 LOBBY 화면")
    void lobbyWithoutGame() {
        room.setGame(null);

        GameView view = projector.project(room, Viewer.player(MAFIA));

        assertThat(view.getPhase()).isEqualTo(GamePhase.LOBBY);
        assertThat(view.getRoster()).isEmpty();
    }
}
