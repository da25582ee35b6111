package com.example.gridbattle.model.event;

public record DeathEvent(int tick, String unitId, String cause) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.DEATH;
    }
}
