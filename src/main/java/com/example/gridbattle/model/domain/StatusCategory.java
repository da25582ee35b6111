package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StatusCategory {
    BUFF,
    DEBUFF,
    CONTROL, // unit skips its action
    DOT,
    SPECIAL;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
