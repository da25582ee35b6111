package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived stats a status effect may modify. Current hp is deliberately absent.
 */
public enum Stat {
    MAX_HP("maxHp"),
    DAMAGE("damage"),
    SPEED("speed"),
    DEFENSE("defense"),
    CRIT_CHANCE("critChance"),
    CRIT_DAMAGE("critDamage"),
    EVASION("evasion"),
    ACCURACY("accuracy"),
    PENETRATION("penetration"),
    LIFESTEAL("lifesteal");

    private final String id;

    Stat(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static Stat fromId(String id) {
        for (Stat stat : values()) {
            if (stat.id.equals(id)) {
                return stat;
            }
        }
        throw new IllegalArgumentException("Unknown stat: " + id);
    }
}
