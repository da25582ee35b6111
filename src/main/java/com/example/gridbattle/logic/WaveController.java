package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.BattleState;
import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.Side;
import com.example.gridbattle.model.event.DefeatEvent;
import com.example.gridbattle.model.event.UnitTransition;
import com.example.gridbattle.model.event.VictoryEvent;
import com.example.gridbattle.model.event.WaveCompleteEvent;
import com.example.gridbattle.model.event.WaveStartEvent;
import com.example.gridbattle.model.event.WaveTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides the battle outcome after every state change and stages the next enemy wave.
 */
@Slf4j
public class WaveController {

    public enum Outcome {
        CONTINUE,
        WAVE_SPAWNED,
        FINISHED
    }

    private static final int SLOT_WRAP = 12;

    private final BattleContext context;

    public WaveController(BattleContext context) {
        this.context = context;
    }

    /**
     * Formation slot {@code index} of a side. Heroes fill the two left columns, enemies the two right ones.
     */
    public static GridPosition slot(int index, boolean hero, BattleSettings settings) {
        int height = settings.getGridHeight();
        int width = settings.getGridWidth();
        int row = index < SLOT_WRAP
                ? Math.min(2 + index / 2, height - 1)
                : ((index - SLOT_WRAP) / 2) % height;
        int col = hero ? index % 2 : width - 1 - index % 2;
        return new GridPosition(row, col);
    }

    public Outcome checkOutcome() {
        BattleState state = context.getState();
        if (state.isFinished()) {
            return Outcome.FINISHED;
        }
        if (context.getLivingHeroes().isEmpty()) {
            finish(Side.ENEMIES);
            return Outcome.FINISHED;
        }
        if (!context.getLivingEnemies().isEmpty()) {
            return Outcome.CONTINUE;
        }
        if (state.getCurrentWave() < state.getTotalWaves()) {
            advanceWave();
            return Outcome.WAVE_SPAWNED;
        }
        finish(Side.HEROES);
        return Outcome.FINISHED;
    }

    public void finish(Side winner) {
        BattleState state = context.getState();
        state.setWinner(winner);
        state.setTransitionInProgress(false);
        if (winner == Side.HEROES) {
            context.emit(new VictoryEvent(context.getTick()));
        } else {
            context.emit(new DefeatEvent(context.getTick()));
        }
        log.info("Battle finished at tick {}: {} win (wave {}/{}{})", context.getTick(), winner,
                state.getCurrentWave(), state.getTotalWaves(), state.isTimedOut() ? ", tick ceiling" : "");
    }

    private void advanceWave() {
        BattleState state = context.getState();
        BattleSettings settings = context.getSettings();
        int cleared = state.getCurrentWave();
        int next = cleared + 1;
        int total = state.getTotalWaves();

        if (cleared % settings.getWavePauseInterval() == 0 || cleared == total - 1) {
            context.emit(new WaveCompleteEvent(context.getTick(), cleared, next, total));
        }

        clearRemnants(next);
        List<UnitTransition> heroMoves = shiftHeroes();
        List<UnitTransition> arrivals = spawnWave(next);

        state.setCurrentWave(next);
        state.setRemainingEnemyWaves(total - next);
        state.setTransitionInProgress(true);

        context.emit(new WaveTransitionEvent(context.getTick(), next, settings.getScrollDistance(), heroMoves));
        context.emit(new WaveStartEvent(context.getTick(), next, total, arrivals));
        log.debug("Tick {}: wave {} cleared, wave {}/{} spawned with {} enemies", context.getTick(), cleared,
                next, total, arrivals.size());
    }

    private void clearRemnants(int nextWave) {
        GridOccupancy grid = context.getGrid();
        for (BattleUnit enemy : context.getState().getEnemies()) {
            if (enemy.getWave() != null && enemy.getWave() < nextWave
                    && enemy.getId().equals(grid.getOccupant(enemy.getPosition()))) {
                grid.vacate(enemy.getPosition());
            }
        }
    }

    /**
     * Leftmost heroes move first. Each walks right from its desired column to the first free cell in its row.
     */
    private List<UnitTransition> shiftHeroes() {
        GridOccupancy grid = context.getGrid();
        int shift = context.getSettings().getScrollDistance() + 1;
        List<BattleUnit> heroes = context.getLivingHeroes().stream()
                .sorted(Comparator.comparingInt(h -> h.getPosition().col()))
                .collect(Collectors.toList());

        List<UnitTransition> moves = new ArrayList<>();
        for (BattleUnit hero : heroes) {
            GridPosition from = hero.getPosition();
            GridPosition to = from;
            for (int col = Math.max(0, from.col() - shift); col < from.col(); col++) {
                GridPosition candidate = new GridPosition(from.row(), col);
                if (grid.move(hero.getId(), from, candidate)) {
                    to = candidate;
                    break;
                }
            }
            hero.setPosition(to);
            moves.add(new UnitTransition(hero.getId(), from, to));
        }
        return moves;
    }

    private List<UnitTransition> spawnWave(int wave) {
        BattleSettings settings = context.getSettings();
        GridOccupancy grid = context.getGrid();
        int searchRadius = Math.max(settings.getGridWidth(), settings.getGridHeight());

        List<UnitTransition> arrivals = new ArrayList<>();
        int index = 0;
        for (BattleUnit enemy : context.getState().getEnemies()) {
            if (enemy.getWave() == null || enemy.getWave() != wave) {
                continue;
            }
            GridPosition target = grid.findNearestFree(slot(index++, false, settings), searchRadius);
            if (target == null) {
                log.warn("Tick {}: no free cell for {} of wave {}, it stays off the board", context.getTick(),
                        enemy.getId(), wave);
                continue;
            }
            grid.occupy(target, enemy.getId());
            arrivals.add(new UnitTransition(enemy.getId(), enemy.getPosition(), target));
            enemy.setPosition(target);
        }
        return arrivals;
    }
}
