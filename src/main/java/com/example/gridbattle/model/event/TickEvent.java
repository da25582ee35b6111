package com.example.gridbattle.model.event;

import java.util.List;

public record TickEvent(int tick, List<CooldownSnapshot> cooldowns) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.TICK;
    }
}
