package com.example.gridbattle.model.event;

public record DefeatEvent(int tick) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.DEFEAT;
    }
}
