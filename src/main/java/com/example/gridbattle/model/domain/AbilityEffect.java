package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AbilityEffect {
    private EffectType type;
    @Builder.Default
    private TargetType targetType = TargetType.ENEMY;
    @Builder.Default
    private AreaPattern pattern = AreaPattern.RADIUS;

    private double value;
    private Integer radius;
    private StatusEffectType statusType;
    private Integer duration;
    private Double damagePerTick;
    private StatModifier statModifier;

    public int getRadiusOrDefault() {
        return radius == null ? 1 : radius;
    }

    public int getDurationOrDefault() {
        return duration == null ? 3 : duration;
    }
}
