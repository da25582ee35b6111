package com.example.gridbattle.model.event;

public record CriticalHitEvent(int tick, String attackerId, String targetId) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.CRITICAL_HIT;
    }
}
