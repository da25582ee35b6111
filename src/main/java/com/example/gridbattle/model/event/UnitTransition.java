package com.example.gridbattle.model.event;

import com.example.gridbattle.model.domain.GridPosition;

/**
 * Logical move of a unit during a wave transition. {@code from} is only meaningful for animation.
 */
public record UnitTransition(String unitId, GridPosition from, GridPosition to) {
}
