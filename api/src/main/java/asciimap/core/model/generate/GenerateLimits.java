package asciimap.core.model.generate;

/**
 * Inclusive bounds applied to generate requests.
 *
 * @param minWidth       smallest accepted width
 * @param maxWidth       largest accepted width
 * @param minSupersample smallest accepted supersample factor
 * @param maxSupersample largest accepted supersample factor
 * @param minCharAspect  smallest accepted character aspect
 * @param maxCharAspect  largest accepted character aspect
 * @param maxMargin      largest accepted margin; the lower bound is always zero
 */
public record GenerateLimits(
        int minWidth,
        int maxWidth,
        int minSupersample,
        int maxSupersample,
        double minCharAspect,
        double maxCharAspect,
        int maxMargin) {

    public static final int DEFAULT_MIN_WIDTH = 20;
    public static final int DEFAULT_MAX_WIDTH = 240;
    public static final int DEFAULT_MIN_SUPERSAMPLE = 1;
    public static final int DEFAULT_MAX_SUPERSAMPLE = 5;
    public static final double DEFAULT_MIN_CHAR_ASPECT = 1.0;
    public static final double DEFAULT_MAX_CHAR_ASPECT = 3.5;
    public static final int DEFAULT_MAX_MARGIN = 12;

    public static GenerateLimits defaults() {
        return new GenerateLimits(
                DEFAULT_MIN_WIDTH,
                DEFAULT_MAX_WIDTH,
                DEFAULT_MIN_SUPERSAMPLE,
                DEFAULT_MAX_SUPERSAMPLE,
                DEFAULT_MIN_CHAR_ASPECT,
                DEFAULT_MAX_CHAR_ASPECT,
                DEFAULT_MAX_MARGIN);
    }
}
