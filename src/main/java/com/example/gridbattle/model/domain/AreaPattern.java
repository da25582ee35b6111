package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of an {@link TargetType#AOE} effect.
 */
public enum AreaPattern {
    /** Every opponent within {@code radius} of the nearest in-range target. */
    RADIUS,
    /** One adjacent primary target plus up to two opponents adjacent to both it and the caster. */
    CLEAVE,
    /** Fixed 2x2 block anchored at the nearest in-range target. */
    BLOCK;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
