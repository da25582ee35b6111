package com.example.gridbattle.model.event;

import com.example.gridbattle.model.domain.StatusEffectType;

public record StatusAppliedEvent(int tick, String unitId, String statusId, StatusEffectType statusType,
                                 int duration, String sourceId) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.STATUS_APPLIED;
    }
}
