package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.BattleState;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.StatusEffectType;
import com.example.gridbattle.model.event.BattleEvent;
import com.example.gridbattle.model.event.DamageEvent;
import com.example.gridbattle.model.event.DeathEvent;
import com.example.gridbattle.model.event.HealEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mutable state of one simulation shared by the engine components.
 * Confined to the single thread running the battle.
 */
public class BattleContext {

    private final BattleSettings settings;
    private final GridOccupancy grid;
    private final BattleEventLog log = new BattleEventLog();
    private final CombatRandom random;
    private final BattleState state = new BattleState();
    private int statusSequence;

    public BattleContext(BattleSettings settings, CombatRandom random) {
        this.settings = settings;
        this.random = random;
        this.grid = new GridOccupancy(settings.getGridHeight(), settings.getGridWidth());
        this.state.setEvents(log.getEvents());
    }

    public BattleSettings getSettings() {
        return settings;
    }

    public GridOccupancy getGrid() {
        return grid;
    }

    public BattleEventLog getLog() {
        return log;
    }

    public CombatRandom getRandom() {
        return random;
    }

    public BattleState getState() {
        return state;
    }

    public int getTick() {
        return state.getTick();
    }

    public void emit(BattleEvent event) {
        log.append(event);
    }

    public String nextStatusId(StatusEffectType type, String sourceId) {
        return type.getId() + "_" + sourceId + "_" + (++statusSequence);
    }

    // --- Roster queries, always in roster order (heroes first) ---

    public List<BattleUnit> getAllUnits() {
        List<BattleUnit> all = new ArrayList<>(state.getHeroes());
        all.addAll(state.getEnemies());
        return all;
    }

    /**
     * Living units that are on the board. Later-wave enemies waiting off-board are excluded.
     */
    public List<BattleUnit> getLivingUnits() {
        return getAllUnits().stream()
                .filter(u -> u.isAlive() && u.isOnBoard(settings.getGridWidth()))
                .collect(Collectors.toList());
    }

    public List<BattleUnit> getLivingHeroes() {
        return getLivingUnits().stream().filter(BattleUnit::isHero).collect(Collectors.toList());
    }

    public List<BattleUnit> getLivingEnemies() {
        return getLivingUnits().stream().filter(u -> !u.isHero()).collect(Collectors.toList());
    }

    public List<BattleUnit> getOpponents(BattleUnit unit) {
        return unit.isHero() ? getLivingEnemies() : getLivingHeroes();
    }

    /**
     * Living units on the same side, the unit itself included.
     */
    public List<BattleUnit> getAllies(BattleUnit unit) {
        return unit.isHero() ? getLivingHeroes() : getLivingEnemies();
    }

    // --- HP mutations, each one logged ---

    /**
     * Subtracts hp (floored at 0) and logs the damage. Death is checked separately by the caller.
     */
    public void damage(BattleUnit target, double amount, String source, StatusEffectType statusType) {
        double remaining = Math.max(0, target.getStats().getHp() - amount);
        target.getStats().setHp(remaining);
        emit(new DamageEvent(getTick(), target.getId(), amount, remaining, source, statusType));
    }

    /**
     * Marks the unit dead when its hp is gone: vacates its cell, drops its status effects.
     *
     * @return whether the unit died
     */
    public boolean killIfDead(BattleUnit unit, String cause) {
        if (!unit.isAlive() || unit.getStats().getHp() > 0) {
            return false;
        }
        unit.setAlive(false);
        unit.getStatusEffects().clear();
        if (unit.getId().equals(grid.getOccupant(unit.getPosition()))) {
            grid.vacate(unit.getPosition());
        }
        emit(new DeathEvent(getTick(), unit.getId(), cause));
        return true;
    }

    /**
     * Heals up to max hp.
     *
     * @return the amount actually restored
     */
    public double heal(BattleUnit unit, double amount, String source) {
        double missing = unit.getStats().getMaxHp() - unit.getStats().getHp();
        double healed = Math.min(amount, Math.max(0, missing));
        if (healed <= 0) {
            return 0;
        }
        unit.getStats().setHp(unit.getStats().getHp() + healed);
        emit(new HealEvent(getTick(), unit.getId(), healed, source));
        return healed;
    }
}
