package asciimap.core.model.generate;

import java.util.Objects;

/**
 * Validated colour settings for a generate request.
 *
 * @param mode        whether a colourised variant is rendered
 * @param mapColor    colour of land cells
 * @param frameColor  colour of the border
 * @param markerColor colour of the marker glyphs
 */
public record ColorConfig(ColorMode mode, AnsiColor mapColor, AnsiColor frameColor, AnsiColor markerColor) {

    public ColorConfig {
        Objects.requireNonNull(mode, "mode must not be null");
        mapColor = Objects.requireNonNullElse(mapColor, AnsiColor.DEFAULT);
        frameColor = Objects.requireNonNullElse(frameColor, AnsiColor.DEFAULT);
        markerColor = Objects.requireNonNullElse(markerColor, AnsiColor.DEFAULT);
    }

    public boolean colorized() {
        return mode == ColorMode.ALWAYS;
    }
}
