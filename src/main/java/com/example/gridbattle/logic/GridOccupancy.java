package com.example.gridbattle.logic;

import com.example.gridbattle.model.domain.BattleUnit;
import com.example.gridbattle.model.domain.GridPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exclusive cell -> unit id mapping. The only place that decides which cell holds which unit.
 * Rejected operations return {@code false}; callers try their next candidate.
 */
public class GridOccupancy {

    private final int height;
    private final int width;
    private final String[][] cells;

    public GridOccupancy(int height, int width) {
        this.height = height;
        this.width = width;
        this.cells = new String[height][width];
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public boolean isInBounds(GridPosition pos) {
        return pos != null && pos.isInBounds(height, width);
    }

    public boolean isFree(GridPosition pos) {
        return isInBounds(pos) && cells[pos.row()][pos.col()] == null;
    }

    public String getOccupant(GridPosition pos) {
        return isInBounds(pos) ? cells[pos.row()][pos.col()] : null;
    }

    public boolean occupy(GridPosition pos, String unitId) {
        if (!isFree(pos)) {
            return false;
        }
        cells[pos.row()][pos.col()] = unitId;
        return true;
    }

    public void vacate(GridPosition pos) {
        if (isInBounds(pos)) {
            cells[pos.row()][pos.col()] = null;
        }
    }

    /**
     * Atomic: either the unit ends up on {@code to} and {@code from} is released, or nothing changes.
     */
    public boolean move(String unitId, GridPosition from, GridPosition to) {
        if (!isFree(to) || !unitId.equals(getOccupant(from))) {
            return false;
        }
        cells[from.row()][from.col()] = null;
        cells[to.row()][to.col()] = unitId;
        return true;
    }

    /**
     * Growing-ring search: the centre, then the perimeter of each radius up to {@code maxRadius}.
     */
    public GridPosition findNearestFree(GridPosition center, int maxRadius) {
        if (isFree(center)) {
            return center;
        }
        for (int radius = 1; radius <= maxRadius; radius++) {
            for (int dRow = -radius; dRow <= radius; dRow++) {
                for (int dCol = -radius; dCol <= radius; dCol++) {
                    if (Math.abs(dRow) != radius && Math.abs(dCol) != radius) {
                        continue;
                    }
                    GridPosition candidate = center.offset(dRow, dCol);
                    if (isFree(candidate)) {
                        return candidate;
                    }
                }
            }
        }
        return null;
    }

    public int countOccupied() {
        int count = 0;
        for (String[] row : cells) {
            for (String cell : row) {
                if (cell != null) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Compares the store with the units' logical positions and forces the store to agree with them.
     *
     * @return one description per mismatch found, empty when consistent
     */
    public List<String> reconcile(Collection<BattleUnit> units) {
        List<String> issues = new ArrayList<>();
        Map<String, BattleUnit> placed = new LinkedHashMap<>();
        for (BattleUnit unit : units) {
            if (unit.isAlive() && isInBounds(unit.getPosition())) {
                placed.put(unit.getId(), unit);
            }
        }

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                String occupant = cells[r][c];
                if (occupant == null) {
                    continue;
                }
                BattleUnit unit = placed.get(occupant);
                GridPosition cell = new GridPosition(r, c);
                if (unit == null) {
                    issues.add("Cell " + cell + " held by " + occupant + " which is not a living unit on the board");
                    cells[r][c] = null;
                } else if (!unit.getPosition().equals(cell)) {
                    issues.add("Cell " + cell + " held by " + occupant + " which is at " + unit.getPosition());
                    cells[r][c] = null;
                }
            }
        }

        for (BattleUnit unit : placed.values()) {
            GridPosition pos = unit.getPosition();
            String occupant = getOccupant(pos);
            if (unit.getId().equals(occupant)) {
                continue;
            }
            if (occupant == null) {
                issues.add("Unit " + unit.getId() + " at " + pos + " was missing from the grid");
                occupy(pos, unit.getId());
                continue;
            }
            GridPosition relocated = findNearestFree(pos, Math.max(height, width));
            issues.add("Unit " + unit.getId() + " shares " + pos + " with " + occupant + ", relocated to " + relocated);
            if (relocated != null) {
                unit.setPosition(relocated);
                occupy(relocated, unit.getId());
            }
        }
        return issues;
    }
}
