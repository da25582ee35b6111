package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AbilityType {
    OFFENSIVE,
    SUPPORT;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
