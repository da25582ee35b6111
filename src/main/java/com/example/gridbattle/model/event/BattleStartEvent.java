package com.example.gridbattle.model.event;

import java.util.List;

public record BattleStartEvent(int tick, List<String> heroIds, List<String> enemyIds, int totalWaves) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.BATTLE_START;
    }
}
