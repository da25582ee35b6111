package com.example.gridbattle.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusEffect {
    private String id; // unique per application
    private StatusEffectType statusType;
    private int duration;
    private int remainingDuration;
    private double damagePerTick;
    private double value; // heal per tick for regeneration
    private StatModifier modifier;
    private String sourceId;
    private String sourceAbilityId;

    public StatusCategory getCategory() {
        return statusType.getCategory();
    }

    public boolean isActive() {
        return remainingDuration > 0;
    }
}
