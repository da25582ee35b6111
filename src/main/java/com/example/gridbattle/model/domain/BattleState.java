package com.example.gridbattle.model.domain;

import com.example.gridbattle.model.event.BattleEvent;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a simulation: final rosters plus the ordered event log.
 */
@Data
@NoArgsConstructor
public class BattleState {
    private int tick;
    private List<BattleUnit> heroes = new ArrayList<>();
    private List<BattleUnit> enemies = new ArrayList<>();
    private List<BattleEvent> events = new ArrayList<>();
    private Side winner; // null while the battle is running

    private int currentWave = 1;
    private int totalWaves = 1;
    private int remainingEnemyWaves;

    // Set when a wave was spawned during the latest tick
    private boolean transitionInProgress;
    // Winner decided by the tick ceiling
    private boolean timedOut;

    public boolean isFinished() {
        return winner != null;
    }
}
