package com.example.gridbattle.model.event;

import com.example.gridbattle.model.domain.StatusEffectType;

public record StatusExpiredEvent(int tick, String unitId, String statusId, StatusEffectType statusType) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.STATUS_EXPIRED;
    }
}
