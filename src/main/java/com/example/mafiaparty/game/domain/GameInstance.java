package com.example.mafiaparty.game.domain;

import com.example.mafiaparty.room.domain.ClientId;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 방 하나의 진행 중인 게임 상태 (정규 상태).
 * 참가자 목록은 게임 시작 시점에 고정되고 이후 늘거나 줄지 않는다.
 */
@Getter
public class GameInstance {

    private final String gameKey;
    private final Instant startedAt;

    private GamePhase phase = GamePhase.ROLE_REVEAL;
    private int round = 1;

    private final Map<ClientId, PlayerRole> roles;
    private final Map<ClientId, Boolean> alive;
    private final Map<ClientId, String> names;

    // actor -> target, 제출 순서 유지 (재제출 시 맨 뒤로 이동)
    private final Map<ClientId, ClientId> nightSelections = new LinkedHashMap<>();
    // voter -> target
    private final Map<ClientId, ClientId> dayVotes = new LinkedHashMap<>();
    private final Map<ClientId, List<Investigation>> investigations = new LinkedHashMap<>();

    private ResolutionResult lastResolution;
    private Team winningTeam;
    private boolean pointsAwarded;

    public GameInstance(String gameKey, Map<ClientId, String> names, Map<ClientId, PlayerRole> roles, Instant startedAt) {
        if (!names.keySet().equals(roles.keySet())) {
            throw new IllegalArgumentException("모든 참가자는 정확히 하나의 역할을 가져야 합니다.");
        }
        this.gameKey = gameKey;
        this.startedAt = startedAt;
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
        this.roles = new LinkedHashMap<>(roles);
        this.alive = new LinkedHashMap<>();
        names.keySet().forEach(id -> alive.put(id, true));
    }

    // --- 조회 ---

    public boolean isParticipant(ClientId clientId) {
        return roles.containsKey(clientId);
    }

    public boolean isAlive(ClientId clientId) {
        return Boolean.TRUE.equals(alive.get(clientId));
    }

    public PlayerRole roleOf(ClientId clientId) {
        return roles.get(clientId);
    }

    public String nameOf(ClientId clientId) {
        return names.get(clientId);
    }

    public boolean isEnded() {
        return winningTeam != null;
    }

    public List<ClientId> getParticipants() {
        return new ArrayList<>(roles.keySet());
    }

    public List<ClientId> alivePlayers() {
        return alive.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public long countAlive(Team team) {
        return alivePlayers().stream()
                .filter(id -> roles.get(id).getTeam() == team)
                .count();
    }

    /**
     * 이번 밤에 행동해야 하는 (살아있고 밤 능력이 있는) 플레이어들
     */
    public List<ClientId> aliveNightActors() {
        return alivePlayers().stream()
                .filter(id -> roles.get(id).canActAtNight())
                .collect(Collectors.toList());
    }

    // 읽기 전용 뷰. 변경은 이 클래스의 메서드로만 한다.

    public Map<ClientId, PlayerRole> getRoles() {
        return Collections.unmodifiableMap(roles);
    }

    public Map<ClientId, Boolean> getAlive() {
        return Collections.unmodifiableMap(alive);
    }

    public Map<ClientId, ClientId> getNightSelections() {
        return Collections.unmodifiableMap(nightSelections);
    }

    public Map<ClientId, ClientId> getDayVotes() {
        return Collections.unmodifiableMap(dayVotes);
    }

    public Map<ClientId, List<Investigation>> getInvestigations() {
        return Collections.unmodifiableMap(investigations);
    }

    public List<Investigation> investigationsOf(ClientId detective) {
        return Collections.unmodifiableList(investigations.getOrDefault(detective, List.of()));
    }

    // --- 변경 ---

    /**
     * 페이즈 전환. 종료된 게임은 더 이상 움직이지 않는다.
     */
    public void moveTo(GamePhase next) {
        if (isEnded()) {
            return;
        }
        this.phase = next;
    }

    public void nextRound() {
        this.round++;
    }

    public void recordNightSelection(ClientId actor, ClientId target) {
        nightSelections.remove(actor);
        nightSelections.put(actor, target);
    }

    public void clearNightSelections() {
        nightSelections.clear();
    }

    public void clearNightSelection(ClientId actor) {
        nightSelections.remove(actor);
    }

    public void recordVote(ClientId voter, ClientId target) {
        dayVotes.put(voter, target);
    }

    public void clearVotes() {
        dayVotes.clear();
    }

    public void addInvestigation(ClientId detective, Investigation investigation) {
        investigations.computeIfAbsent(detective, k -> new ArrayList<>()).add(investigation);
    }

    public void setAlive(ClientId clientId, boolean value) {
        if (isParticipant(clientId)) {
            alive.put(clientId, value);
        }
    }

    public void assignRole(ClientId clientId, PlayerRole role) {
        if (isParticipant(clientId)) {
            roles.put(clientId, role);
        }
    }

    public void setLastResolution(ResolutionResult lastResolution) {
        this.lastResolution = lastResolution;
    }

    /**
     * 승리 팀 확정. 한 번 정해지면 바뀌지 않는다.
     *
     * @return 이번 호출로 처음 확정되었으면 true
     */
    public boolean declareWinner(Team team) {
        if (isEnded()) {
            return false;
        }
        this.winningTeam = team;
        this.phase = GamePhase.ENDED;
        return true;
    }

    /**
     * @return 아직 점수를 주지 않았으면 true 를 돌려주고 지급 완료로 표시한다
     */
    public boolean markPointsAwarded() {
        if (pointsAwarded) {
            return false;
        }
        pointsAwarded = true;
        return true;
    }
}
