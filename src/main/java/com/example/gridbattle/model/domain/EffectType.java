package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of ability effect kinds; resolution switches over every constant.
 */
public enum EffectType {
    DAMAGE,
    HEAL,
    BUFF,
    STATUS,
    LIFESTEAL;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
