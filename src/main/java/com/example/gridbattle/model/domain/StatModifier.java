package com.example.gridbattle.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatModifier {
    private Stat stat;
    private double value;
    @JsonProperty("isPercent")
    private boolean percent; // value is a percentage of the stat

    /**
     * Percent modifiers scale, flat modifiers add and never push the stat below zero.
     */
    public double applyTo(double current) {
        return percent ? current * (1 + value / 100.0) : Math.max(0, current + value);
    }
}
