package com.example.mafiaparty.game.domain;

public enum PlayerRole {
    MAFIA(Team.MAFIA, NightActionType.KILL, "밤에 한 명을 지목하여 제거할 수 있습니다."),
    DETECTIVE(Team.TOWN, NightActionType.CHECK, "밤에 한 명을 지목하여 마피아인지 확인할 수 있습니다."),
    DOCTOR(Team.TOWN, NightActionType.SAVE, "밤에 한 명을 지목하여 마피아의 공격으로부터 보호할 수 있습니다."),
    VILLAGER(Team.TOWN, null, "특별한 능력이 없습니다. 추리를 통해 마피아를 찾아내세요.");

    private final Team team;
    private final NightActionType nightAction;
    private final String description;

    PlayerRole(Team team, NightActionType nightAction, String description) {
        this.team = team;
        this.nightAction = nightAction;
        this.description = description;
    }

    public Team getTeam() {
        return team;
    }

    /**
     * 밤에 할 수 있는 행동. 시민은 null.
     */
    public NightActionType getNightAction() {
        return nightAction;
    }

    public boolean canActAtNight() {
        return nightAction != null;
    }

    public String getDescription() {
        return description;
    }
}
