package com.example.gridbattle.model.event;

import java.util.List;

public record AbilityUsedEvent(int tick, String casterId, String abilityId, String abilityName, List<String> targetIds) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.ABILITY_USED;
    }
}
