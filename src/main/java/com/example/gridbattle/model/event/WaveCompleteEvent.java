package com.example.gridbattle.model.event;

public record WaveCompleteEvent(int tick, int waveNumber, int nextWaveNumber, int totalWaves) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.WAVE_COMPLETE;
    }
}
