package com.example.gridbattle.model.event;

public record HealEvent(int tick, String unitId, double amount, String source) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.HEAL;
    }
}
