package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.BattleState;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.dto.UnitDefinition;
import com.example.gridbattle.model.event.BattleStartEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic tick-based battle between a hero roster and one or more enemy waves.
 * Identical rosters, settings and random sequence give an identical event log.
 */
@Slf4j
public class BattleEngine {

    private final BattleContext context;
    private final TickScheduler scheduler;

    public BattleEngine(List<UnitDefinition> heroes, List<List<UnitDefinition>> enemyWaves,
            BattleSettings settings, CombatRandom random) {
        new BattleSetupValidator(settings).validate(heroes, enemyWaves);

        this.context = new BattleContext(settings, random);
        StatusEffectProcessor statusProcessor = new StatusEffectProcessor(context);
        TargetingResolver targeting = new TargetingResolver(context);
        AbilityResolver abilityResolver = new AbilityResolver(context, targeting, statusProcessor);
        WaveController waveController = new WaveController(context);
        this.scheduler = new TickScheduler(context, statusProcessor, abilityResolver, waveController);

        BattleState state = context.getState();
        state.setTotalWaves(enemyWaves.size());
        state.setRemainingEnemyWaves(enemyWaves.size() - 1);
        placeHeroes(heroes, statusProcessor);
        placeEnemies(enemyWaves, statusProcessor);

        context.emit(new BattleStartEvent(0,
                state.getHeroes().stream().map(BattleUnit::getId).collect(Collectors.toList()),
                context.getLivingEnemies().stream().map(BattleUnit::getId).collect(Collectors.toList()),
                enemyWaves.size()));
        log.info("Battle created: {} heroes vs {} enemy waves on a {}x{} grid", heroes.size(), enemyWaves.size(),
                settings.getGridWidth(), settings.getGridHeight());
    }

    /**
     * Runs ticks until one side wins or the tick ceiling decides.
     */
    public BattleState simulate() {
        while (!context.getState().isFinished()) {
            step();
        }
        return context.getState();
    }

    /**
     * Advances exactly one tick.
     *
     * @return whether the battle is still running afterwards
     */
    public boolean step() {
        if (context.getState().isFinished()) {
            throw new IllegalStateException("Battle is already finished at tick " + context.getTick());
        }
        scheduler.runTick();
        return !context.getState().isFinished();
    }

    public BattleState getState() {
        return context.getState();
    }

    GridOccupancy getGrid() {
        return context.getGrid();
    }

    private void placeHeroes(List<UnitDefinition> heroes, StatusEffectProcessor statusProcessor) {
        BattleSettings settings = context.getSettings();
        GridOccupancy grid = context.getGrid();
        // explicit formations first so slot heroes cannot take their cells
        for (UnitDefinition def : heroes) {
            if (def.getPosition() != null) {
                grid.occupy(def.getPosition(), def.getId());
            }
        }
        for (int i = 0; i < heroes.size(); i++) {
            UnitDefinition def = heroes.get(i);
            GridPosition pos = def.getPosition();
            if (pos == null) {
                pos = grid.findNearestFree(WaveController.slot(i, true, settings), searchRadius());
                if (pos == null) {
                    throw new IllegalArgumentException("No free cell left for hero " + def.getId());
                }
                grid.occupy(pos, def.getId());
            }
            context.getState().getHeroes().add(createUnit(def, true, pos, null, statusProcessor));
        }
    }

    private void placeEnemies(List<List<UnitDefinition>> enemyWaves, StatusEffectProcessor statusProcessor) {
        BattleSettings settings = context.getSettings();
        GridOccupancy grid = context.getGrid();
        for (int w = 0; w < enemyWaves.size(); w++) {
            List<UnitDefinition> wave = enemyWaves.get(w);
            for (int i = 0; i < wave.size(); i++) {
                UnitDefinition def = wave.get(i);
                GridPosition slot = WaveController.slot(i, false, settings);
                GridPosition pos;
                if (w == 0) {
                    GridPosition wanted = def.getPosition() != null ? def.getPosition() : slot;
                    pos = grid.findNearestFree(wanted, searchRadius());
                    if (pos == null) {
                        log.warn("No free cell for enemy {}, it stays off the board", def.getId());
                        pos = new GridPosition(slot.row(), settings.getOffBoardColumn());
                    } else {
                        grid.occupy(pos, def.getId());
                    }
                } else {
                    pos = new GridPosition(slot.row(), settings.getOffBoardColumn());
                }
                context.getState().getEnemies().add(createUnit(def, false, pos, w + 1, statusProcessor));
            }
        }
    }

    private BattleUnit createUnit(UnitDefinition def, boolean hero, GridPosition pos, Integer wave,
            StatusEffectProcessor statusProcessor) {
        BattleUnit unit = new BattleUnit();
        unit.setId(def.getId());
        unit.setName(def.getName() == null ? def.getId() : def.getName());
        unit.setHero(hero);
        unit.setPosition(pos);
        unit.setWave(wave);

        unit.setBaseStats(def.getStats().copy());
        unit.setStats(def.getStats().copy());
        if (unit.getStats().getHp() <= 0) {
            unit.getStats().setHp(unit.getStats().getMaxHp());
        }

        List<Ability> abilities = def.getAbilities() == null ? new ArrayList<>() : new ArrayList<>(def.getAbilities());
        unit.setAbilities(abilities);
        for (Ability ability : abilities) {
            unit.getAbilityCooldowns().put(ability.getId(), 0);
        }
        statusProcessor.recalculateStats(unit);
        return unit;
    }

    private int searchRadius() {
        return Math.max(context.getSettings().getGridWidth(), context.getSettings().getGridHeight());
    }
}
