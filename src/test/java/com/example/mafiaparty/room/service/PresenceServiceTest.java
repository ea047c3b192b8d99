package com.example.mafiaparty.room.service;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.dto.response.GameView;
import com.example.mafiaparty.game.dto.response.RoleAssignment;
import com.example.mafiaparty.global.error.CommonException;
import com.example.mafiaparty.global.error.ErrorCode;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.CloseReason;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.dto.MessageType;
import com.example.mafiaparty.support.PartyFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.example.mafiaparty.support.PartyFixture.HOST_CONN;
import static com.example.mafiaparty.support.PartyFixture.HOST_ID;
import static com.example.mafiaparty.support.PartyFixture.conn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PresenceServiceTest {

    private PartyFixture fixture;
    private PresenceService presenceService;
    private String code;

    @BeforeEach
    void setUp() {
        fixture = new PartyFixture();
        presenceService = fixture.presenceService;
        code = fixture.createRoom();
    }

    private Runnable capturedGraceTask() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(fixture.taskScheduler).schedule(captor.capture(), any(Instant.class));
        return captor.getValue();
    }

    // ==================== 호스트 ====================

    @Test
    @DisplayName("호스트 연결이 끊기면 방은 유예 시간 동안 유지된다")
    void hostDetachStartsGraceTimer() {
        presenceService.detach(HOST_CONN);

        assertThat(fixture.registry.exists(code)).isTrue();
        assertThat(fixture.room(code).getHostConnection()).isNull();
        assertThat(fixture.graceTimerService.isScheduled(code)).isTrue();
        assertThat(fixture.broadcaster.toRoom(code, MessageType.ROOM_CLOSED)).isEmpty();
    }

    @Test
    @DisplayName("유예 시간 안에 호스트가 돌아오면 타이머가 취소되고 방이 유지된다")
    void hostReattachCancelsGraceTimer() {
        presenceService.detach(HOST_CONN);

        presenceService.attachHost(code, HOST_ID, "host-conn-2");

        verify(fixture.scheduledFuture).cancel(false);
        assertThat(fixture.graceTimerService.isScheduled(code)).isFalse();
        assertThat(fixture.room(code).isHostConnection("host-conn-2")).isTrue();
        assertThat(fixture.broadcaster.toConnection("host-conn-2", MessageType.ROOM_STATE)).isNotEmpty();

        // 취소된 뒤 늦게 실행되어도 호스트가 있으므로 방은 남는다
        capturedGraceTask().run();
        assertThat(fixture.registry.exists(code)).isTrue();
        assertThat(fixture.lockStrategy.released()).isEmpty();
    }

    @Test
    @DisplayName("유예 시간이 끝나면 방이 HOST_LEFT 로 닫힌다")
    void graceExpiryDestroysRoom() {
        presenceService.detach(HOST_CONN);

        capturedGraceTask().run();

        assertThat(fixture.registry.exists(code)).isFalse();
        assertThat(fixture.broadcaster.toRoom(code, MessageType.ROOM_CLOSED).get(0).getPayload())
                .isEqualTo(Map.of("reason", CloseReason.HOST_LEFT));
        // 락 객체는 락을 놓은 뒤에 정리된다
        assertThat(fixture.lockStrategy.released()).containsExactly(Room.lockKey(code));
        assertThat(fixture.lockStrategy.releasedWhileHeld()).isEmpty();
    }

    @Test
    @DisplayName("유예 시간이 0이면 호스트가 끊기는 즉시 방이 닫힌다")
    void zeroGraceClosesImmediately() {
        fixture.properties.getRoom().setHostGraceSeconds(0);

        presenceService.detach(HOST_CONN);

        assertThat(fixture.registry.exists(code)).isFalse();
        verify(fixture.taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertThat(fixture.lockStrategy.released()).containsExactly(Room.lockKey(code));
        assertThat(fixture.lockStrategy.releasedWhileHeld()).isEmpty();
    }

    @Test
    @DisplayName("다른 식별자로 호스트 재연결을 시도하면 NOT_HOST")
    void attachHostRequiresHostIdentity() {
        assertThatThrownBy(() -> presenceService.attachHost(code, "intruder", "conn-x"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NOT_HOST);
        assertThat(fixture.room(code).isHostConnection(HOST_CONN)).isTrue();
    }

    // ==================== 플레이어 ====================

    @Test
    @DisplayName("방에 없는 식별자의 재연결은 PLAYER_NOT_FOUND")
    void attachUnknownPlayerIsRejected() {
        assertThatThrownBy(() -> presenceService.attachPlayer(code, "stranger", "conn-s"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.PLAYER_NOT_FOUND);
    }

    @Test
    @DisplayName("플레이어 연결이 끊겨도 게임에는 남고, 재연결하면 자기 역할과 생존 여부를 그 연결로만 받는다")
    void reattachRestoresPrivateStateOnlyToThatIdentity() {
        Map<String, PlayerRole> roles = new LinkedHashMap<>();
        roles.put("m1", PlayerRole.MAFIA);
        roles.put("v1", PlayerRole.VILLAGER);
        roles.put("v2", PlayerRole.VILLAGER);
        GameInstance game = fixture.startWithRoles(code, roles);

        presenceService.detach(conn("m1"));
        Room room = fixture.room(code);
        assertThat(room.findPlayer(ClientId.of("m1")).isConnected()).isFalse();
        assertThat(game.isParticipant(ClientId.of("m1"))).isTrue();

        fixture.broadcaster.clear();
        presenceService.attachPlayer(code, "m1", "conn-m1-new");

        RoleAssignment assignment = fixture.broadcaster.lastPayload("conn-m1-new", MessageType.ROLE_ASSIGNED);
        assertThat(assignment.role()).isEqualTo(PlayerRole.MAFIA);
        GameView view = fixture.broadcaster.lastPayload("conn-m1-new", MessageType.GAME_STATE);
        assertThat(view.getSelf().role()).isEqualTo(PlayerRole.MAFIA);
        assertThat(view.getSelf().alive()).isTrue();

        assertThat(fixture.broadcaster.toConnection(conn("v1"))).isEmpty();
        assertThat(fixture.broadcaster.toConnection(conn("v2"))).isEmpty();
        assertThat(fixture.broadcaster.toConnection(HOST_CONN)).isEmpty();
        assertThat(fixture.broadcaster.toConnection(conn("m1"))).isEmpty();
    }

    @Test
    @DisplayName("새 연결로 재연결하면 이전 연결은 잊힌다")
    void previousConnectionIsForgotten() {
        fixture.roomService.join(code, "a", "Alice", "conn-a");
        presenceService.attachPlayer(code, "a", "conn-a2");

        presenceService.detach("conn-a");

        assertThat(fixture.room(code).findPlayer(ClientId.of("a")).getConnectionId()).isEqualTo("conn-a2");
    }
}
