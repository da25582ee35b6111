package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Ability {
    private String id;
    private String name;
    private AbilityType type;
    private Integer range; // tiles, melee when absent
    private int cooldown; // actions before the ability is ready again
    @Builder.Default
    private List<AbilityEffect> effects = new ArrayList<>();

    public int getRangeOrDefault() {
        return range == null || range < 1 ? 1 : range;
    }

    public boolean hasEffect(EffectType effectType) {
        return effects.stream().anyMatch(e -> e.getType() == effectType);
    }
}
