package com.example.gridbattle.model.event;

import com.example.gridbattle.model.domain.GridPosition;

public record MoveEvent(int tick, String unitId, GridPosition from, GridPosition to) implements BattleEvent {

    @Override
    public BattleEventType kind() {
        return BattleEventType.MOVE;
    }
}
