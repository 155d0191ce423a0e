package com.hotel.reconciliation.blocking;

import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.geo.GeoDistance;

import java.util.List;

/**
 * How many grid cells around a listing's own cell are searched for candidates.
 *
 * <p>A neighborhood sized with {@link #covering} reaches every cell that can hold a point
 * within {@code radiusKm} of a point in the center cell. Longitude cells narrow with latitude,
 * so the longitude reach is computed per cell from the latitude farthest from the equator
 * that such a point can have. Near the poles the longitude reach spans half the globe.</p>
 *
 * <p>The reach is never less than one cell in either direction.</p>
 */
public final class GridNeighborhood {

    private static final double EARTH_RADIUS_KM = GeoDistance.EARTH_RADIUS_METERS / 1000.0;
    private static final double KM_PER_DEGREE_LATITUDE = EARTH_RADIUS_KM * Math.PI / 180.0;

    private static final GridNeighborhood ADJACENT = new GridNeighborhood(1.0, 0.0);

    private final double cellSizeDegrees;
    private final double radiusKm;
    private final long latitudeReach;
    private final long maxLongitudeReach;

    private GridNeighborhood(double cellSizeDegrees, double radiusKm) {
        this.cellSizeDegrees = cellSizeDegrees;
        this.radiusKm = radiusKm;
        this.maxLongitudeReach = (long) Math.ceil(180.0 / cellSizeDegrees);
        this.latitudeReach = Math.min(maxLongitudeReach,
                atLeastOne(radiusKm / KM_PER_DEGREE_LATITUDE / cellSizeDegrees));
    }

    /**
     * The cell itself and its 8 adjacent cells.
     */
    public static GridNeighborhood adjacent() {
        return ADJACENT;
    }

    /**
     * A neighborhood reaching every listing within {@code radiusKm} of the center cell.
     *
     * @throws ConfigurationException when the cell size or the radius is not a positive finite number
     */
    public static GridNeighborhood covering(double cellSizeDegrees, double radiusKm) {
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0) {
            throw new ConfigurationException("grid cell size must be a positive number of degrees, got "
                    + cellSizeDegrees);
        }
        if (!Double.isFinite(radiusKm) || radiusKm < 0.0) {
            throw new ConfigurationException("search radius must be >= 0 km, got " + radiusKm);
        }
        return new GridNeighborhood(cellSizeDegrees, radiusKm);
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public long latitudeReach() {
        return latitudeReach;
    }

    /**
     * Number of cells searched east and west of {@code cell}.
     */
    public long longitudeReach(GridCell cell) {
        if (radiusKm == 0.0 || !cell.located()) {
            return 1;
        }
        double southEdge = Math.abs(cell.latIndex() * cellSizeDegrees);
        double northEdge = Math.abs((cell.latIndex() + 1) * cellSizeDegrees);
        double farthestLatitude = Math.max(southEdge, northEdge) + radiusKm / KM_PER_DEGREE_LATITUDE;
        if (farthestLatitude >= 90.0) {
            return maxLongitudeReach;
        }
        // Haversine bound: sin(d / 2R) >= cos(lat) * sin(dLon / 2)
        double bound = Math.sin(radiusKm / (2.0 * EARTH_RADIUS_KM)) / Math.cos(Math.toRadians(farthestLatitude));
        if (bound >= 1.0) {
            return maxLongitudeReach;
        }
        double longitudeSpan = Math.toDegrees(2.0 * Math.asin(bound));
        return Math.min(maxLongitudeReach, atLeastOne(longitudeSpan / cellSizeDegrees));
    }

    /**
     * Cells to search around {@code cell}, the cell itself first.
     */
    public List<GridCell> around(GridCell cell) {
        return cell.neighborhood(latitudeReach, longitudeReach(cell));
    }

    private static long atLeastOne(double cells) {
        return Math.max(1L, (long) Math.ceil(cells));
    }

    @Override
    public String toString() {
        return this == ADJACENT ? "GridNeighborhood{adjacent}"
                : "GridNeighborhood{radiusKm=" + radiusKm + ", cellSizeDegrees=" + cellSizeDegrees + '}';
    }
}
