package com.example.gridbattle.model.event;

public record EvadedEvent(int tick, String attackerId, String targetId) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.EVADED;
    }
}
