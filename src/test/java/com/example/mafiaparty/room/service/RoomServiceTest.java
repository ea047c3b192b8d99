package com.example.mafiaparty.room.service;

import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.global.error.CommonException;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.CloseReason;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.domain.RoomPlayer;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.room.dto.RoomMessage;
import com.example.mafiaparty.support.PartyFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.mafiaparty.support.PartyFixture.HOST_CONN;
import static com.example.mafiaparty.support.PartyFixture.HOST_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomServiceTest {

    private PartyFixture fixture;
    private RoomService roomService;

    @BeforeEach
    void setUp() {
        fixture = new PartyFixture();
        roomService = fixture.roomService;
    }

    private static void assertError(Runnable call, ErrorCode expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("방을 만들면 4자리 코드가 호스트 연결에 전달된다")
    void createRoomSendsCodeToHost() {
        String code = fixture.createRoom();

        assertThat(code).hasSize(4);
        assertThat(code.chars()).allMatch(c -> RoomCodeGenerator.ALPHABET.indexOf(c) >= 0);
        assertThat(fixture.broadcaster.toConnection(HOST_CONN, MessageType.ROOM_CREATED)).hasSize(1);
        assertThat(fixture.broadcaster.toRoom(code, MessageType.ROOM_STATE)).isNotEmpty();
        assertThat(fixture.room(code).isHostConnection(HOST_CONN)).isTrue();
    }

    @Test
    @DisplayName("같은 호스트가 방을 다시 만들면 이전 방은 HOST_RECREATED 로 닫힌다")
    void recreatingClosesPreviousRoom() {
        String first = fixture.createRoom();
        String second = roomService.createRoom(HOST_ID, "host-conn-2");

        assertThat(fixture.registry.exists(first)).isFalse();
        assertThat(fixture.registry.exists(second)).isTrue();
        List<RoomMessage> closed = fixture.broadcaster.toRoom(first, MessageType.ROOM_CLOSED);
        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).getPayload()).isEqualTo(Map.of("reason", CloseReason.HOST_RECREATED));
        assertThat(fixture.lockStrategy.released()).containsExactly(Room.lockKey(first));
    }

    @Test
    @DisplayName("64자를 넘는 식별자는 잘리지 않고 거부되어 다른 플레이어와 합쳐지지 않는다")
    void overlongClientIdIsRejected() {
        String code = fixture.createRoom();
        String prefix = "a".repeat(RoomValidator.MAX_CLIENT_ID_LENGTH);

        assertError(() -> roomService.join(code, prefix + "X", "Alice", "conn-1"), ErrorCode.CLIENT_ID_TOO_LONG);
        assertError(() -> roomService.join(code, prefix + "Y", "Bob", "conn-2"), ErrorCode.CLIENT_ID_TOO_LONG);
        assertThat(fixture.room(code).getPlayers()).isEmpty();

        roomService.join(code, prefix, "Alice", "conn-1");
        assertError(() -> roomService.join(code, prefix + "Y", "Bob", "conn-2"), ErrorCode.CLIENT_ID_TOO_LONG);
        assertThat(fixture.room(code).getPlayerList())
                .extracting(RoomPlayer::getDisplayName)
                .containsExactly("Alice");
    }

    @Test
    @DisplayName("입장 오류: 없는 방, 빈 이름, 빈 식별자, 중복 이름")
    void joinValidation() {
        String code = fixture.createRoom();
        roomService.join(code, "a", "Alice", "conn-a");

        assertError(() -> roomService.join("ZZZZ9", "b", "Bob", "conn-b"), ErrorCode.ROOM_NOT_FOUND);
        assertError(() -> roomService.join(code, "b", "   ", "conn-b"), ErrorCode.NAME_REQUIRED);
        assertError(() -> roomService.join(code, " ", "Bob", "conn-b"), ErrorCode.CLIENT_ID_REQUIRED);
        assertError(() -> roomService.join(code, "b", "alice", "conn-b"), ErrorCode.NAME_ALREADY_TAKEN);

        assertThat(fixture.room(code).getPlayers()).hasSize(1);
    }

    @Test
    @DisplayName("방 코드는 공백/소문자/기호를 정리해서 찾는다")
    void joinNormalizesCode() {
        String code = fixture.createRoom();
        String messy = " " + code.substring(0, 2).toLowerCase() + "-" + code.substring(2) + " ";

        roomService.join(messy, "a", "Alice", "conn-a");

        assertThat(fixture.room(code).findPlayer(ClientId.of("a"))).isNotNull();
        assertThat(fixture.broadcaster.toConnection("conn-a", MessageType.PLAYER_JOINED)).hasSize(1);
    }

    @Test
    @DisplayName("이름은 앞뒤 공백을 지우고 24자로 자른다")
    void nameIsTrimmedAndCapped() {
        String code = fixture.createRoom();

        RoomPlayer player = roomService.join(code, "a", "   " + "x".repeat(30) + "  ", "conn-a");

        assertThat(player.getDisplayName()).isEqualTo("x".repeat(24));
    }

    @Test
    @DisplayName("같은 식별자로 다시 입장하면 새 플레이어가 아니라 이름과 연결만 바뀐다")
    void rejoinWithSameIdentity() {
        String code = fixture.createRoom();
        roomService.join(code, "a", "Alice", "conn-a");
        roomService.setReady(code, "a", true);

        roomService.join(code, "a", "Alicia", "conn-a2");

        Room room = fixture.room(code);
        assertThat(room.getPlayers()).hasSize(1);
        RoomPlayer player = room.findPlayer(ClientId.of("a"));
        assertThat(player.getDisplayName()).isEqualTo("Alicia");
        assertThat(player.getConnectionId()).isEqualTo("conn-a2");
        assertThat(player.isReady()).isTrue();
    }

    @Test
    @DisplayName("없는 플레이어의 준비 요청은 PLAYER_NOT_FOUND")
    void readyRequiresKnownPlayer() {
        String code = fixture.createRoom();

        assertError(() -> roomService.setReady(code, "ghost", true), ErrorCode.PLAYER_NOT_FOUND);
    }

    @Test
    @DisplayName("게임 중 퇴장해도 게임의 자리는 그대로 남는다")
    void leaveDuringGameKeepsSeat() {
        String code = fixture.createRoom();
        Map<String, PlayerRole> roles = new LinkedHashMap<>();
        roles.put("m1", PlayerRole.MAFIA);
        roles.put("v1", PlayerRole.VILLAGER);
        roles.put("v2", PlayerRole.VILLAGER);
        fixture.startWithRoles(code, roles);

        roomService.leave(code, "v1");

        Room room = fixture.room(code);
        assertThat(room.findPlayer(ClientId.of("v1"))).isNull();
        assertThat(room.getGame().isParticipant(ClientId.of("v1"))).isTrue();
        assertThat(room.getGame().isAlive(ClientId.of("v1"))).isTrue();
    }

    @Test
    @DisplayName("호스트만 게임 종류와 개발 모드를 바꿀 수 있다")
    void hostSettings() {
        String code = fixture.createRoom();
        roomService.join(code, "a", "Alice", "conn-a");

        assertError(() -> roomService.setDevMode(code, true, "conn-a"), ErrorCode.NOT_HOST);
        assertError(() -> roomService.setCurrentGame(code, "mafia", "conn-a"), ErrorCode.NOT_HOST);
        assertError(() -> roomService.setCurrentGame(code, "poker", HOST_CONN), ErrorCode.UNKNOWN_GAME);

        roomService.setDevMode(code, true, HOST_CONN);
        assertThat(roomService.getRoomState(code).devMode()).isTrue();
    }
}
