package com.example.gridbattle.logic;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tuning constants of the simulation. Immutable, shared between battles.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class BattleSettings {

    @Builder.Default
    private final int gridWidth = 8;
    @Builder.Default
    private final int gridHeight = 8;
    @Builder.Default
    private final int maxTicks = 10000;
    @Builder.Default
    private final double cooldownDivisor = 10;
    @Builder.Default
    private final int scrollDistance = 2;
    @Builder.Default
    private final int wavePauseInterval = 3;
    @Builder.Default
    private final double healThreshold = 0.99;
    @Builder.Default
    private final int consistencyCheckInterval = 1;

    public static BattleSettings defaults() {
        return BattleSettings.builder().build();
    }

    public int getOffBoardColumn() {
        return gridWidth;
    }
}
