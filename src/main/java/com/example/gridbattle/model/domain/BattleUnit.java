package com.example.gridbattle.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BattleUnit {

    @EqualsAndHashCode.Include
    private String id; // stable for the whole battle
    private String name;
    private boolean hero;
    private GridPosition position;

    private UnitStats baseStats;
    private UnitStats stats;
    private List<StatusEffect> statusEffects = new ArrayList<>();

    private List<Ability> abilities = new ArrayList<>();
    // ability id -> actions remaining until ready, 0 when ready
    private Map<String, Integer> abilityCooldowns = new LinkedHashMap<>();

    private double cooldown; // 0..100, acts at 100
    private double cooldownRate;
    private boolean alive = true;
    private Integer wave; // enemies only

    public boolean isOnBoard(int gridWidth) {
        return position != null && position.col() < gridWidth;
    }

    public boolean isAbilityReady(Ability ability) {
        return abilityCooldowns.getOrDefault(ability.getId(), 0) <= 0;
    }

    public boolean hasActive(StatusCategory category) {
        return statusEffects.stream().anyMatch(e -> e.isActive() && e.getCategory() == category);
    }

    public boolean isDamaged(double threshold) {
        return stats.getHp() < stats.getMaxHp() * threshold;
    }
}
