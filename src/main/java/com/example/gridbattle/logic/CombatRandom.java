package com.example.gridbattle.logic;

/**
 * Source of the crit and evasion rolls. Replays are deterministic for a deterministic source.
 */
public interface CombatRandom {

    /**
     * @return a value in {@code [0, 1)}
     */
    double nextDouble();
}
