package com.example.gridbattle.service;

import com.example.gridbattle.logic.BattleEngine;
import com.example.gridbattle.logic.BattleSettings;
import com.example.gridbattle.logic.SeededCombatRandom;
import com.example.gridbattle.model.domain.BattleState;
import com.example.gridbattle.model.dto.UnitDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point for callers: runs complete battles with the configured settings and exports their logs.
 */
@Slf4j
@Service
public class BattleService {

    private final BattleSettings settings;
    private final ObjectMapper objectMapper;

    public BattleService(BattleSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    public BattleState simulate(List<UnitDefinition> heroes, List<List<UnitDefinition>> enemyWaves, long seed) {
        log.info("Simulating battle: {} heroes, {} waves, seed {}", heroes == null ? 0 : heroes.size(),
                enemyWaves == null ? 0 : enemyWaves.size(), seed);
        BattleEngine engine = new BattleEngine(heroes, enemyWaves, settings, new SeededCombatRandom(seed));
        BattleState state = engine.simulate();
        log.info("Battle over after {} ticks, winner {}, {} events", state.getTick(), state.getWinner(),
                state.getEvents().size());
        return state;
    }

    /**
     * Runs with a fresh seed, which is logged so the battle can be replayed.
     */
    public BattleState simulate(List<UnitDefinition> heroes, List<List<UnitDefinition>> enemyWaves) {
        return simulate(heroes, enemyWaves, ThreadLocalRandom.current().nextLong());
    }

    /**
     * Single-wave battle from a flat enemy list.
     */
    public BattleState simulateSingleWave(List<UnitDefinition> heroes, List<UnitDefinition> enemies, long seed) {
        return simulate(heroes, singleWave(enemies), seed);
    }

    public static List<List<UnitDefinition>> singleWave(List<UnitDefinition> enemies) {
        return enemies == null ? List.of() : List.of(enemies);
    }

    public List<UnitDefinition> readRoster(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, new TypeReference<List<UnitDefinition>>() {
        });
    }

    public String exportJson(BattleState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize battle state at tick " + state.getTick(), e);
        }
    }
}
