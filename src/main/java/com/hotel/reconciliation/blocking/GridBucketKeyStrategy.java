package com.hotel.reconciliation.blocking;

import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.GeoPoint;

/**
 * Bucket keys from fixed-size degree rounding plus the first cleaned name token.
 *
 * <p>Cells are not wrapped at the antimeridian: listings on both sides of longitude 180
 * land in non-adjacent cells and are never compared.</p>
 */
public class GridBucketKeyStrategy implements BucketKeyStrategy {

    private final double cellSizeDegrees;
    private final boolean useNameToken;

    public GridBucketKeyStrategy(double cellSizeDegrees, boolean useNameToken) {
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0) {
            throw new ConfigurationException("grid cell size must be a positive number of degrees, got "
                    + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        this.useNameToken = useNameToken;
    }

    @Override
    public BucketKey keyFor(String cleanedName, GeoPoint coordinates) {
        return new BucketKey(cellFor(coordinates), useNameToken ? firstToken(cleanedName) : "");
    }

    /**
     * Computes the grid cell holding the given coordinates.
     */
    public GridCell cellFor(GeoPoint coordinates) {
        if (coordinates == null) {
            return GridCell.UNLOCATED;
        }
        return GridCell.of(
                (long) Math.floor(coordinates.latitude() / cellSizeDegrees),
                (long) Math.floor(coordinates.longitude() / cellSizeDegrees));
    }

    public double getCellSizeDegrees() {
        return cellSizeDegrees;
    }

    public boolean isUseNameToken() {
        return useNameToken;
    }

    static String firstToken(String cleanedName) {
        if (cleanedName == null || cleanedName.isBlank()) {
            return "";
        }
        String trimmed = cleanedName.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
