package com.example.gridbattle.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One entry of the append-only battle log. Every kind is an immutable record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BattleStartEvent.class, name = "battleStart"),
        @JsonSubTypes.Type(value = TickEvent.class, name = "tick"),
        @JsonSubTypes.Type(value = MoveEvent.class, name = "move"),
        @JsonSubTypes.Type(value = AttackEvent.class, name = "attack"),
        @JsonSubTypes.Type(value = AbilityUsedEvent.class, name = "abilityUsed"),
        @JsonSubTypes.Type(value = DamageEvent.class, name = "damage"),
        @JsonSubTypes.Type(value = HealEvent.class, name = "heal"),
        @JsonSubTypes.Type(value = EvadedEvent.class, name = "evaded"),
        @JsonSubTypes.Type(value = CriticalHitEvent.class, name = "criticalHit"),
        @JsonSubTypes.Type(value = StatusAppliedEvent.class, name = "statusApplied"),
        @JsonSubTypes.Type(value = StatusExpiredEvent.class, name = "statusExpired"),
        @JsonSubTypes.Type(value = DeathEvent.class, name = "death"),
        @JsonSubTypes.Type(value = WaveStartEvent.class, name = "waveStart"),
        @JsonSubTypes.Type(value = WaveCompleteEvent.class, name = "waveComplete"),
        @JsonSubTypes.Type(value = WaveTransitionEvent.class, name = "waveTransition"),
        @JsonSubTypes.Type(value = VictoryEvent.class, name = "victory"),
        @JsonSubTypes.Type(value = DefeatEvent.class, name = "defeat")
})
public interface BattleEvent {

    int tick();

    @JsonIgnore
    BattleEventType kind();
}
