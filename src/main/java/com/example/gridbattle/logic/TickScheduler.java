package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.BattleState;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.Side;
import com.example.gridbattle.model.domain.StatusCategory;
import com.example.gridbattle.model.event.CooldownSnapshot;
import com.example.gridbattle.model.event.TickEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives one tick: status phase, outcome check, cooldown fill, then the ready units act in order.
 */
@Slf4j
public class TickScheduler {

    public static final double READY = 100;

    private final BattleContext context;
    private final StatusEffectProcessor statusProcessor;
    private final AbilityResolver abilityResolver;
    private final WaveController waveController;

    public TickScheduler(BattleContext context, StatusEffectProcessor statusProcessor,
            AbilityResolver abilityResolver, WaveController waveController) {
        this.context = context;
        this.statusProcessor = statusProcessor;
        this.abilityResolver = abilityResolver;
        this.waveController = waveController;
    }

    public void runTick() {
        BattleState state = context.getState();
        state.setTick(state.getTick() + 1);
        state.setTransitionInProgress(false);

        statusProcessor.processTick();
        if (waveController.checkOutcome() == WaveController.Outcome.FINISHED) {
            return;
        }

        clampPositions();
        checkConsistency();
        advanceCooldowns();

        // List.sort is stable, so equal cooldowns keep roster order
        List<BattleUnit> ready = context.getLivingUnits().stream()
                .filter(u -> u.getCooldown() >= READY)
                .collect(Collectors.toList());
        ready.sort(Comparator.comparingDouble(BattleUnit::getCooldown).reversed());

        Set<GridPosition> claimed = new HashSet<>();
        for (BattleUnit unit : ready) {
            if (!unit.isAlive() || !unit.isOnBoard(context.getSettings().getGridWidth())) {
                continue;
            }
            Ability used = null;
            if (unit.hasActive(StatusCategory.CONTROL)) {
                log.debug("Tick {}: {} is disabled and skips its action", state.getTick(), unit.getId());
            } else {
                used = abilityResolver.act(unit, claimed);
            }
            finishAction(unit, used);

            if (waveController.checkOutcome() != WaveController.Outcome.CONTINUE) {
                break;
            }
        }

        if (!state.isFinished() && state.getTick() >= context.getSettings().getMaxTicks()) {
            resolveStalemate();
        }
    }

    /**
     * Resets the gauge and ticks every ability cooldown down by one use, then arms the ability just cast.
     */
    void finishAction(BattleUnit unit, Ability used) {
        unit.setCooldown(0);
        for (Map.Entry<String, Integer> entry : unit.getAbilityCooldowns().entrySet()) {
            if (entry.getValue() > 0) {
                entry.setValue(entry.getValue() - 1);
            }
        }
        if (used != null) {
            unit.getAbilityCooldowns().put(used.getId(), used.getCooldown());
        }
    }

    private void clampPositions() {
        BattleSettings settings = context.getSettings();
        for (BattleUnit unit : context.getLivingUnits()) {
            unit.setPosition(unit.getPosition().clamp(settings.getGridHeight(), settings.getGridWidth()));
        }
    }

    private void checkConsistency() {
        int interval = context.getSettings().getConsistencyCheckInterval();
        if (interval <= 0 || context.getTick() % interval != 0) {
            return;
        }
        for (String issue : context.getGrid().reconcile(context.getLivingUnits())) {
            log.warn("Tick {}: occupancy repaired: {}", context.getTick(), issue);
        }
    }

    private void advanceCooldowns() {
        List<CooldownSnapshot> snapshots = new ArrayList<>();
        for (BattleUnit unit : context.getLivingUnits()) {
            unit.setCooldown(Math.min(READY, unit.getCooldown() + unit.getCooldownRate()));
            snapshots.add(new CooldownSnapshot(unit.getId(), unit.getCooldown(), unit.getCooldownRate()));
        }
        context.emit(new TickEvent(context.getTick(), snapshots));
    }

    private void resolveStalemate() {
        double heroHp = totalHp(context.getLivingHeroes());
        double enemyHp = totalHp(context.getLivingEnemies());
        log.info("Tick ceiling {} reached, deciding by remaining hp: heroes {} vs enemies {}",
                context.getSettings().getMaxTicks(), heroHp, enemyHp);
        context.getState().setTimedOut(true);
        waveController.finish(heroHp > enemyHp ? Side.HEROES : Side.ENEMIES);
    }

    private static double totalHp(List<BattleUnit> units) {
        return units.stream().mapToDouble(u -> u.getStats().getHp()).sum();
    }
}
