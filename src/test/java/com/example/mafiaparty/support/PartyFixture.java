package com.example.mafiaparty.support;

import com.example.mafiaparty.game.domain.GameInstance;
import com.example.mafiaparty.game.domain.PlayerRole;
import com.example.mafiaparty.game.service.GameService;
import com.example.mafiaparty.game.service.GameViewProjector;
import com.example.mafiaparty.game.service.PhaseResultProcessor;
import com.example.mafiaparty.game.service.RoleAssigner;
import com.example.mafiaparty.game.state.DayDiscussionState;
import com.example.mafiaparty.game.state.GamePhaseFactory;
import com.example.mafiaparty.game.state.NightState;
import com.example.mafiaparty.game.state.ResolutionState;
import com.example.mafiaparty.game.state.RoleRevealState;
import com.example.mafiaparty.game.state.VoteState;
import com.example.mafiaparty.game.strategy.DetectiveAction;
import com.example.mafiaparty.game.strategy.DoctorAction;
import com.example.mafiaparty.game.strategy.MafiaAction;
import com.example.mafiaparty.game.strategy.RoleActionFactory;
import com.example.mafiaparty.global.concurrency.strategy.SynchronizedLockStrategy;
import com.example.mafiaparty.global.config.PartyProperties;
import com.example.mafiaparty.global.dev.DevModeService;
import com.example.mafiaparty.room.domain.ClientId;
import com.example.mafiaparty.room.domain.Room;
import com.example.mafiaparty.room.service.HostGraceTimerService;
import com.example.mafiaparty.room.service.PresenceService;
import com.example.mafiaparty.room.service.RoomCodeGenerator;
import com.example.mafiaparty.room.service.RoomEventPublisher;
import com.example.mafiaparty.room.service.RoomRegistry;
import com.example.mafiaparty.room.service.RoomService;
import com.example.mafiaparty.room.service.RoomValidator;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

/**
 * 스프링 컨텍스트 없이 서비스들을 직접 조립한 테스트 환경.
 * 스케줄러는 mock 이고, 보낸 메시지는 {@link RecordingBroadcaster} 에 쌓인다.
 */
public class PartyFixture {

    public static final String HOST_ID = "host-1";
    public static final String HOST_CONN = "host-conn";

    public final PartyProperties properties = new PartyProperties();
    public final RecordingBroadcaster broadcaster = new RecordingBroadcaster();
    public final TrackingLockStrategy lockStrategy = new TrackingLockStrategy(new SynchronizedLockStrategy());
    public final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    public final ScheduledFuture<?> scheduledFuture = mock(ScheduledFuture.class);

    public final RoomRegistry registry;
    public final RoomEventPublisher publisher;
    public final HostGraceTimerService graceTimerService;
    public final RoomService roomService;
    public final PresenceService presenceService;
    public final PhaseResultProcessor resultProcessor;
    public final GameService gameService;
    public final DevModeService devModeService;

    public PartyFixture() {
        this(new Random(42));
    }

    public PartyFixture(Random random) {
        doReturn(scheduledFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        RoomCodeGenerator codeGenerator = new RoomCodeGenerator(properties, random);
        registry = new RoomRegistry(codeGenerator);
        GameViewProjector projector = new GameViewProjector();
        publisher = new RoomEventPublisher(broadcaster, projector);
        RoomValidator validator = new RoomValidator(properties);
        graceTimerService = new HostGraceTimerService(taskScheduler);
        roomService = new RoomService(registry, publisher, validator, graceTimerService, lockStrategy);
        presenceService = new PresenceService(registry, roomService, publisher, validator, graceTimerService,
                lockStrategy, properties);

        RoleActionFactory roleActionFactory = new RoleActionFactory(new MafiaAction(), new DoctorAction(),
                new DetectiveAction());
        resultProcessor = new PhaseResultProcessor(roleActionFactory, publisher, properties);
        GamePhaseFactory phaseFactory = new GamePhaseFactory(new RoleRevealState(), new NightState(),
                new DayDiscussionState(), new VoteState(), new ResolutionState());
        gameService = new GameService(registry, validator, publisher, new RoleAssigner(random), projector,
                phaseFactory, resultProcessor, roleActionFactory, lockStrategy, properties);
        devModeService = new DevModeService(registry, publisher, resultProcessor, lockStrategy);
    }

    public String createRoom() {
        return roomService.createRoom(HOST_ID, HOST_CONN);
    }

    public Room room(String code) {
        return registry.getRoom(code);
    }

    public static String conn(String clientId) {
        return "conn-" + clientId;
    }

    /**
     * 플레이어 입장 + 준비. 연결 id 는 "conn-{clientId}", 이름은 clientId 를 대문자로.
     */
    public void joinReady(String code, String... clientIds) {
        for (String id : clientIds) {
            roomService.join(code, id, id.toUpperCase(), conn(id));
            roomService.setReady(code, id, true);
        }
    }

    /**
     * 주어진 플레이어로 게임을 시작하고 역할을 원하는 대로 덮어쓴다. 순서는 입장 순서.
     */
    public GameInstance startWithRoles(String code, Map<String, PlayerRole> roles) {
        joinReady(code, roles.keySet().toArray(new String[0]));
        if (roles.size() < properties.getGame().getMinPlayers()) {
            roomService.setDevMode(code, true, HOST_CONN);
        }
        gameService.startGame(code, HOST_CONN);
        GameInstance game = room(code).getGame();
        roles.forEach((id, role) -> game.assignRole(ClientId.of(id), role));
        return game;
    }

    /**
     * ROLE_REVEAL 에서 NIGHT 로
     */
    public void toNight(String code) {
        gameService.advancePhase(code, HOST_CONN);
    }
}
