package com.example.gridbattle.model.domain;

/**
 * Cell coordinates on the battle grid.
 * Column {@code gridWidth} is the off-board column used for later-wave enemies before they spawn.
 */
public record GridPosition(int row, int col) {

    /**
     * Chebyshev distance, so a diagonal neighbour is at distance 1.
     */
    public int distanceTo(GridPosition other) {
        return Math.max(Math.abs(row - other.row), Math.abs(col - other.col));
    }

    public GridPosition offset(int dRow, int dCol) {
        return new GridPosition(row + dRow, col + dCol);
    }

    public boolean isInBounds(int height, int width) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public GridPosition clamp(int height, int width) {
        return new GridPosition(Math.max(0, Math.min(height - 1, row)), Math.max(0, Math.min(width - 1, col)));
    }
}
