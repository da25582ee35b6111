package com.example.gridbattle.model.event;

import java.util.List;

public record WaveTransitionEvent(int tick, int waveNumber, int scrollDistance, List<UnitTransition> heroes) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.WAVE_TRANSITION;
    }
}
