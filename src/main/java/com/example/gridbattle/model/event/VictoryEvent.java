package com.example.gridbattle.model.event;

public record VictoryEvent(int tick) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.VICTORY;
    }
}
