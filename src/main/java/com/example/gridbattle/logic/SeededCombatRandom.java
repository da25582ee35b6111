package com.example.gridbattle.logic;

import java.util.SplittableRandom;

public class SeededCombatRandom implements CombatRandom {

    private final SplittableRandom random;

    public SeededCombatRandom(long seed) {
        this.random = new SplittableRandom(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
