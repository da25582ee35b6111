package com.example.gridbattle.config;

import com.example.gridbattle.logic.BattleSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BattleConfig {

    @Value("${battle.grid.width:8}")
    private int gridWidth;

    @Value("${battle.grid.height:8}")
    private int gridHeight;

    @Value("${battle.max-ticks:10000}")
    private int maxTicks;

    @Value("${battle.cooldown.divisor:10}")
    private double cooldownDivisor;

    @Value("${battle.wave.scroll-distance:2}")
    private int scrollDistance;

    @Value("${battle.wave.pause-interval:3}")
    private int wavePauseInterval;

    @Value("${battle.heal-threshold:0.99}")
    private double healThreshold;

    @Value("${battle.consistency-check-interval:1}")
    private int consistencyCheckInterval;

    @Bean
    public BattleSettings battleSettings() {
        return BattleSettings.builder()
                .gridWidth(gridWidth)
                .gridHeight(gridHeight)
                .maxTicks(maxTicks)
                .cooldownDivisor(cooldownDivisor)
                .scrollDistance(scrollDistance)
                .wavePauseInterval(wavePauseInterval)
                .healThreshold(healThreshold)
                .consistencyCheckInterval(consistencyCheckInterval)
                .build();
    }
}
