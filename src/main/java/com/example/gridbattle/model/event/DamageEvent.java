package com.example.gridbattle.model.event;

import com.example.gridbattle.model.domain.StatusEffectType;

public record DamageEvent(int tick, String targetId, double amount, double remainingHp, String source,
                          StatusEffectType statusType) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.DAMAGE;
    }
}
