package com.example.gridbattle.model.event;

public record AttackEvent(int tick, String attackerId, String targetId, boolean critical) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.ATTACK;
    }
}
