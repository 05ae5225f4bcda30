package asciimap.core.model.generate;

/**
 * Metadata derived for a generated map.
 *
 * @param width       requested width in columns
 * @param height      map rows derived from width and character aspect
 * @param supersample supersample factor used
 * @param charAspect  character aspect used
 * @param durationMs  wall-clock milliseconds spent rendering
 * @param bytes       UTF-8 byte length of the plain variant
 */
public record GenerateMeta(int width, int height, int supersample, double charAspect, long durationMs, int bytes) {

    /**
     * Number of map rows for the given geometry, {@code round(width / (2 * charAspect))}.
     *
     * <p>Halves round away from zero.
     */
    public static int deriveHeight(int width, double charAspect) {
        return (int) Math.round(width / (2.0 * charAspect));
    }
}
