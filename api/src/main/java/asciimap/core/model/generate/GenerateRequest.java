package asciimap.core.model.generate;

/**
 * A decoded but unvalidated generate request.
 *
 * <p>Field values are exactly what the client sent, layered over {@link #defaults()}.
 */
public record GenerateRequest(
        int width,
        int supersample,
        double charAspect,
        int margin,
        boolean frame,
        MarkerRequest marker,
        ColorRequest color) {

    public static final int DEFAULT_WIDTH = 120;
    public static final int DEFAULT_SUPERSAMPLE = 3;
    public static final double DEFAULT_CHAR_ASPECT = 2.0;
    public static final int DEFAULT_MARGIN = 2;
    public static final boolean DEFAULT_FRAME = true;

    public GenerateRequest {
        if (marker == null) {
            marker = MarkerRequest.defaults();
        }
        if (color == null) {
            color = ColorRequest.defaults();
        }
    }

    /**
     * The request an empty payload decodes to.
     */
    public static GenerateRequest defaults() {
        return new GenerateRequest(
                DEFAULT_WIDTH,
                DEFAULT_SUPERSAMPLE,
                DEFAULT_CHAR_ASPECT,
                DEFAULT_MARGIN,
                DEFAULT_FRAME,
                MarkerRequest.defaults(),
                ColorRequest.defaults());
    }

    /**
     * Marker settings as sent by the client. Only inspected when {@code enabled} is true.
     */
    public record MarkerRequest(
            boolean enabled,
            double lon,
            double lat,
            String center,
            String horizontal,
            String vertical,
            int armX,
            int armY) {

        public static MarkerRequest defaults() {
            return new MarkerRequest(
                    false,
                    0.0,
                    0.0,
                    String.valueOf(Marker.DEFAULT_CENTER),
                    String.valueOf(Marker.DEFAULT_HORIZONTAL),
                    String.valueOf(Marker.DEFAULT_VERTICAL),
                    Marker.UNBOUNDED_ARM,
                    Marker.UNBOUNDED_ARM);
        }
    }

    /**
     * Colour settings as sent by the client.
     */
    public record ColorRequest(String mode, String mapColor, String frameColor, String markerColor) {

        public static ColorRequest defaults() {
            return new ColorRequest(
                    ColorMode.ALWAYS.wireName(),
                    AnsiColor.GREEN.wireName(),
                    AnsiColor.BRIGHT_WHITE.wireName(),
                    AnsiColor.BRIGHT_RED.wireName());
        }
    }
}
