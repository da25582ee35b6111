package com.example.gridbattle.model.event;

import java.util.List;

public record WaveStartEvent(int tick, int waveNumber, int totalWaves, List<UnitTransition> enemies) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.WAVE_START;
    }
}
