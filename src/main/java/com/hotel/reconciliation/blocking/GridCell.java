package com.hotel.reconciliation.blocking;

import java.util.ArrayList;
import java.util.List;

/**
 * A cell of the fixed-size degree grid used to bound candidate search.
 * Listings without usable coordinates share the {@link #UNLOCATED} cell, which has no neighbors.
 *
 * @param latIndex  floor(latitude / cellSize)
 * @param lonIndex  floor(longitude / cellSize)
 * @param located   false only for {@link #UNLOCATED}
 */
public record GridCell(long latIndex, long lonIndex, boolean located) {

    public static final GridCell UNLOCATED = new GridCell(0, 0, false);

    public static GridCell of(long latIndex, long lonIndex) {
        return new GridCell(latIndex, lonIndex, true);
    }

    /**
     * Returns this cell and its 8 surrounding cells, this cell first.
     * Tolerates coordinates that round into a neighboring cell across a boundary.
     */
    public List<GridCell> neighborhood() {
        return neighborhood(1, 1);
    }

    /**
     * Returns the block of cells within {@code latReach} rows and {@code lonReach} columns of
     * this cell, this cell first and the rest in row order.
     * The unlocated cell is its own only neighbor.
     */
    public List<GridCell> neighborhood(long latReach, long lonReach) {
        if (!located) {
            return List.of(this);
        }
        List<GridCell> cells = new ArrayList<>((int) Math.min(Integer.MAX_VALUE,
                (2 * latReach + 1) * (2 * lonReach + 1)));
        cells.add(this);
        for (long dLat = -latReach; dLat <= latReach; dLat++) {
            for (long dLon = -lonReach; dLon <= lonReach; dLon++) {
                if (dLat != 0 || dLon != 0) {
                    cells.add(of(latIndex + dLat, lonIndex + dLon));
                }
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return located ? "cell(" + latIndex + "," + lonIndex + ")" : "cell(unlocated)";
    }
}
