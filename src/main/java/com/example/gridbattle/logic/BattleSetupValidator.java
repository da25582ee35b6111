package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.AbilityEffect;
import com.example.gridbattle.model.domain.EffectType;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.StatusCategory;
import com.example.gridbattle.model.domain.UnitStats;
import com.example.gridbattle.model.dto.UnitDefinition;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects malformed rosters before the first tick. Nothing is thrown once a battle is running.
 */
public class BattleSetupValidator {

    private final BattleSettings settings;

    public BattleSetupValidator(BattleSettings settings) {
        this.settings = settings;
    }

    public void validate(List<UnitDefinition> heroes, List<List<UnitDefinition>> enemyWaves) {
        if (settings.getGridWidth() < 2 || settings.getGridHeight() < 1) {
            throw new IllegalArgumentException("Grid must be at least 2 columns by 1 row, got "
                    + settings.getGridWidth() + "x" + settings.getGridHeight());
        }
        if (settings.getCooldownDivisor() <= 0 || settings.getMaxTicks() <= 0 || settings.getWavePauseInterval() <= 0) {
            throw new IllegalArgumentException("Invalid battle settings: " + settings);
        }
        if (heroes == null || heroes.isEmpty()) {
            throw new IllegalArgumentException("At least one hero is required");
        }
        if (enemyWaves == null || enemyWaves.isEmpty()) {
            throw new IllegalArgumentException("At least one enemy wave is required");
        }

        Set<String> ids = new HashSet<>();
        Set<GridPosition> heroCells = new HashSet<>();
        for (UnitDefinition hero : heroes) {
            validateUnit(hero, ids);
            GridPosition pos = hero.getPosition();
            if (pos == null) {
                continue;
            }
            if (!pos.isInBounds(settings.getGridHeight(), settings.getGridWidth())) {
                throw new IllegalArgumentException("Hero " + hero.getId() + " starts out of bounds at " + pos);
            }
            if (!heroCells.add(pos)) {
                throw new IllegalArgumentException("Hero " + hero.getId() + " starts on an occupied cell " + pos);
            }
        }
        for (int i = 0; i < enemyWaves.size(); i++) {
            List<UnitDefinition> wave = enemyWaves.get(i);
            if (wave == null || wave.isEmpty()) {
                throw new IllegalArgumentException("Enemy wave " + (i + 1) + " is empty");
            }
            for (UnitDefinition enemy : wave) {
                validateUnit(enemy, ids);
            }
        }
    }

    private void validateUnit(UnitDefinition unit, Set<String> ids) {
        if (unit == null || unit.getId() == null || unit.getId().isBlank()) {
            throw new IllegalArgumentException("Every unit needs an id");
        }
        String id = unit.getId();
        if (!ids.add(id)) {
            throw new IllegalArgumentException("Duplicate unit id " + id);
        }
        UnitStats stats = unit.getStats();
        if (stats == null) {
            throw new IllegalArgumentException("Unit " + id + " has no stats");
        }
        if (stats.getMaxHp() <= 0) {
            throw new IllegalArgumentException("Unit " + id + " must have a positive maxHp");
        }
        if (stats.getHp() > stats.getMaxHp()) {
            throw new IllegalArgumentException("Unit " + id + " has hp above maxHp");
        }
        if (stats.getSpeed() < 0) {
            throw new IllegalArgumentException("Unit " + id + " has a negative speed");
        }
        if (unit.getAbilities() == null) {
            return;
        }
        Set<String> abilityIds = new HashSet<>();
        for (Ability ability : unit.getAbilities()) {
            validateAbility(id, ability, abilityIds);
        }
    }

    private void validateAbility(String unitId, Ability ability, Set<String> abilityIds) {
        if (ability.getId() == null || ability.getId().isBlank()) {
            throw new IllegalArgumentException("Unit " + unitId + " has an ability without id");
        }
        String where = "Ability " + ability.getId() + " of unit " + unitId;
        if (!abilityIds.add(ability.getId())) {
            throw new IllegalArgumentException(where + " is declared twice");
        }
        if (ability.getType() == null) {
            throw new IllegalArgumentException(where + " has no type");
        }
        if (ability.getEffects() == null || ability.getEffects().isEmpty()) {
            throw new IllegalArgumentException(where + " has no effects");
        }
        if (ability.getCooldown() < 0 || (ability.getRange() != null && ability.getRange() < 0)) {
            throw new IllegalArgumentException(where + " has a negative cooldown or range");
        }
        for (AbilityEffect effect : ability.getEffects()) {
            if (effect.getType() == null) {
                throw new IllegalArgumentException(where + " has an effect without type");
            }
            if (effect.getType() == EffectType.STATUS && effect.getStatusType() == null) {
                throw new IllegalArgumentException(where + " applies a status without statusType");
            }
            if (effect.getType() == EffectType.BUFF && effect.getStatModifier() == null) {
                throw new IllegalArgumentException(where + " applies a buff without statModifier");
            }
            if (effect.getType() == EffectType.BUFF && effect.getStatusType() != null
                    && effect.getStatusType().getCategory() != StatusCategory.BUFF) {
                throw new IllegalArgumentException(where + " applies " + effect.getStatusType().getId()
                        + " as a buff");
            }
        }
    }
}
