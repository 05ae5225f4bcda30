package asciimap.core.model.render;

import java.util.Objects;

import asciimap.core.model.generate.AnsiColor;
import asciimap.core.model.generate.ColorConfig;
import asciimap.core.model.generate.ColorMode;

/**
 * Layout and colour options passed to the rendering engine.
 *
 * @param marginRows  blank rows above and below the map
 * @param frame       whether to draw a border
 * @param colorMode   whether to emit ANSI escapes
 * @param mapColor    colour of land cells
 * @param frameColor  colour of the border
 * @param markerColor colour of the marker glyphs
 */
public record RenderOptions(
        int marginRows,
        boolean frame,
        ColorMode colorMode,
        AnsiColor mapColor,
        AnsiColor frameColor,
        AnsiColor markerColor) {

    public RenderOptions {
        Objects.requireNonNull(colorMode, "colorMode must not be null");
        mapColor = Objects.requireNonNullElse(mapColor, AnsiColor.DEFAULT);
        frameColor = Objects.requireNonNullElse(frameColor, AnsiColor.DEFAULT);
        markerColor = Objects.requireNonNullElse(markerColor, AnsiColor.DEFAULT);
    }

    /**
     * Options for the uncoloured variant: colour mode forced to never, palette dropped.
     */
    public static RenderOptions plain(int marginRows, boolean frame) {
        return new RenderOptions(
                marginRows, frame, ColorMode.NEVER, AnsiColor.DEFAULT, AnsiColor.DEFAULT, AnsiColor.DEFAULT);
    }

    /**
     * Options carrying the full colour configuration.
     */
    public static RenderOptions colored(int marginRows, boolean frame, ColorConfig color) {
        return new RenderOptions(
                marginRows, frame, color.mode(), color.mapColor(), color.frameColor(), color.markerColor());
    }

    public boolean colorized() {
        return colorMode == ColorMode.ALWAYS;
    }
}
