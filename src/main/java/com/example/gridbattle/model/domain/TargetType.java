package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TargetType {
    ENEMY,
    AOE,
    SELF;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
