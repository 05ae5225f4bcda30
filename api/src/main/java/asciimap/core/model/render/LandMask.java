package asciimap.core.model.render;

import java.util.BitSet;
import java.util.Objects;

/**
 * Read-only equirectangular land/water grid covering the whole globe.
 *
 * <p>Row 0 is the northern edge (latitude 90), column 0 the western edge (longitude -180).
 * Instances are immutable and shared across concurrent renders.
 */
public final class LandMask {

    private final int columns;
    private final int rows;
    private final BitSet land;

    /**
     * Creates a mask.
     *
     * @param columns number of columns, must be positive
     * @param rows    number of rows, must be positive
     * @param land    set bits mark land, indexed {@code row * columns + column}; copied
     */
    public LandMask(int columns, int rows, BitSet land) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("mask dimensions must be positive, got %dx%d".formatted(columns, rows));
        }
        Objects.requireNonNull(land, "land must not be null");
        this.columns = columns;
        this.rows = rows;
        this.land = (BitSet) land.clone();
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    /**
     * Number of land cells in the grid.
     */
    public int landCells() {
        return land.cardinality();
    }

    public boolean isLand(int column, int row) {
        if (column < 0 || column >= columns || row < 0 || row >= rows) {
            return false;
        }
        return land.get(row * columns + column);
    }

    /**
     * Whether the given coordinate falls on land. Longitudes wrap; latitudes are clamped.
     */
    public boolean isLandAt(double lon, double lat) {
        var wrapped = (lon + 180.0) % 360.0;
        if (wrapped < 0) {
            wrapped += 360.0;
        }
        final var column = Math.min(columns - 1, (int) Math.floor(wrapped / 360.0 * columns));
        final var clampedLat = Math.max(-90.0, Math.min(90.0, lat));
        final var row = Math.min(rows - 1, (int) Math.floor((90.0 - clampedLat) / 180.0 * rows));
        return isLand(column, row);
    }
}
