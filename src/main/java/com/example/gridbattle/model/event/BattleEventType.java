package com.example.gridbattle.model.event;

public enum BattleEventType {
    BATTLE_START,
    TICK,
    MOVE,
    ATTACK,
    ABILITY_USED,
    DAMAGE,
    HEAL,
    EVADED,
    CRITICAL_HIT,
    STATUS_APPLIED,
    STATUS_EXPIRED,
    DEATH,
    WAVE_START,
    WAVE_COMPLETE,
    WAVE_TRANSITION,
    VICTORY,
    DEFEAT
}
