package com.example.gridbattle.model.dto;

import com.example.gridbattle.model.domain.Ability;
import com.example.gridbattle.model.domain.GridPosition;
import com.example.gridbattle.model.domain.UnitStats;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Roster entry handed to the engine by the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnitDefinition {
    private String id;
    private String name;
    private UnitStats stats;
    @Builder.Default
    private List<Ability> abilities = new ArrayList<>();
    // Starting cell for heroes and first-wave enemies; spawn slots are used when absent
    private GridPosition position;
}
