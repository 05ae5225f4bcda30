package asciimap.core.model.generate;

/**
 * A point drawn onto the map, with the glyphs used for its centre and arms.
 *
 * <p>An arm length of {@code -1} is passed to the renderer unchanged and means the arm spans the
 * whole row or column.
 *
 * @param lon        longitude in degrees, {@code [-180, 180]}
 * @param lat        latitude in degrees, {@code [-90, 90]}
 * @param center     glyph at the marker position
 * @param horizontal glyph for the horizontal arm
 * @param vertical   glyph for the vertical arm
 * @param armX       horizontal arm length in cells, {@code -1} or greater
 * @param armY       vertical arm length in cells, {@code -1} or greater
 */
public record Marker(double lon, double lat, char center, char horizontal, char vertical, int armX, int armY) {

    public static final char DEFAULT_CENTER = 'O';
    public static final char DEFAULT_HORIZONTAL = '-';
    public static final char DEFAULT_VERTICAL = '|';
    public static final int UNBOUNDED_ARM = -1;
}
