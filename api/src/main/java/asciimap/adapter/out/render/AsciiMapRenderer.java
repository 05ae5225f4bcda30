package asciimap.adapter.out.render;

import java.util.Arrays;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import asciimap.core.model.generate.AnsiColor;
import asciimap.core.model.generate.GenerateMeta;
import asciimap.core.model.generate.Marker;
import asciimap.core.model.render.LandMask;
import asciimap.core.model.render.RenderException;
import asciimap.core.model.render.RenderOptions;
import asciimap.core.port.out.RenderingEngine;

/**
 * Equirectangular ASCII rasterizer.
 *
 * <p>The map area is {@code width} columns by {@code round(width / (2 * charAspect))} rows.
 * Each cell is sampled {@code supersample x supersample} times and drawn as land when at least
 * half of its samples hit land. Margin rows pad the map vertically, inside the frame when one
 * is drawn.
 *
 * <p>Stateless and safe for concurrent use.
 */
@ApplicationScoped
public class AsciiMapRenderer implements RenderingEngine {

    static final char LAND = '#';
    static final char WATER = ' ';
    static final char FRAME_CORNER = '+';
    static final char FRAME_HORIZONTAL = '-';
    static final char FRAME_VERTICAL = '|';

    private enum CellKind {
        WATER,
        LAND,
        MARKER,
        FRAME
    }

    @Override
    public String render(
            LandMask mask,
            int width,
            int supersample,
            double charAspect,
            Optional<Marker> marker,
            RenderOptions options)
            throws RenderException {
        if (mask == null) {
            throw new RenderException("land mask is required");
        }
        if (width <= 0) {
            throw new RenderException("width must be positive, got " + width);
        }
        if (supersample <= 0) {
            throw new RenderException("supersample must be positive, got " + supersample);
        }
        if (!Double.isFinite(charAspect) || charAspect <= 0) {
            throw new RenderException("char aspect must be a positive finite number");
        }
        if (options.marginRows() < 0) {
            throw new RenderException("margin rows must not be negative");
        }

        final var height = GenerateMeta.deriveHeight(width, charAspect);
        if (height <= 0) {
            throw new RenderException("width %d with char aspect %s yields no rows".formatted(width, charAspect));
        }

        final var glyphs = new char[height][width];
        final var kinds = new CellKind[height][width];
        rasterize(mask, width, height, supersample, glyphs, kinds);
        if (marker != null && marker.isPresent()) {
            drawMarker(marker.get(), width, height, glyphs, kinds);
        }
        return compose(width, glyphs, kinds, options);
    }

    private static void rasterize(
            LandMask mask, int width, int height, int supersample, char[][] glyphs, CellKind[][] kinds) {
        final var samples = supersample * supersample;
        final var cellLon = 360.0 / width;
        final var cellLat = 180.0 / height;

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int landHits = 0;
                for (int sy = 0; sy < supersample; sy++) {
                    final var lat = 90.0 - (row + (sy + 0.5) / supersample) * cellLat;
                    for (int sx = 0; sx < supersample; sx++) {
                        final var lon = -180.0 + (col + (sx + 0.5) / supersample) * cellLon;
                        if (mask.isLandAt(lon, lat)) {
                            landHits++;
                        }
                    }
                }
                final var land = landHits * 2 >= samples;
                glyphs[row][col] = land ? LAND : WATER;
                kinds[row][col] = land ? CellKind.LAND : CellKind.WATER;
            }
        }
    }

    private static void drawMarker(Marker marker, int width, int height, char[][] glyphs, CellKind[][] kinds)
            throws RenderException {
        if (!Double.isFinite(marker.lon()) || marker.lon() < -180.0 || marker.lon() > 180.0
                || !Double.isFinite(marker.lat()) || marker.lat() < -90.0 || marker.lat() > 90.0) {
            throw new RenderException(
                    "marker (%s, %s) is outside the renderable area".formatted(marker.lon(), marker.lat()));
        }
        if (marker.armX() < Marker.UNBOUNDED_ARM || marker.armY() < Marker.UNBOUNDED_ARM) {
            throw new RenderException("marker arm lengths must be -1 or greater");
        }

        final var col = clamp((int) Math.floor((marker.lon() + 180.0) / 360.0 * width), width);
        final var row = clamp((int) Math.floor((90.0 - marker.lat()) / 180.0 * height), height);

        final var fromCol = marker.armX() == Marker.UNBOUNDED_ARM ? 0 : Math.max(0, col - marker.armX());
        final var toCol = marker.armX() == Marker.UNBOUNDED_ARM ? width - 1 : Math.min(width - 1, col + marker.armX());
        for (int c = fromCol; c <= toCol; c++) {
            glyphs[row][c] = marker.horizontal();
            kinds[row][c] = CellKind.MARKER;
        }

        final var fromRow = marker.armY() == Marker.UNBOUNDED_ARM ? 0 : Math.max(0, row - marker.armY());
        final var toRow =
                marker.armY() == Marker.UNBOUNDED_ARM ? height - 1 : Math.min(height - 1, row + marker.armY());
        for (int r = fromRow; r <= toRow; r++) {
            glyphs[r][col] = marker.vertical();
            kinds[r][col] = CellKind.MARKER;
        }

        glyphs[row][col] = marker.center();
        kinds[row][col] = CellKind.MARKER;
    }

    private static String compose(int width, char[][] glyphs, CellKind[][] kinds, RenderOptions options) {
        final var out = new StringBuilder();
        final var blankGlyphs = new char[width];
        final var blankKinds = new CellKind[width];
        Arrays.fill(blankGlyphs, WATER);
        Arrays.fill(blankKinds, CellKind.WATER);

        if (options.frame()) {
            appendBorder(out, width, options);
        }
        for (int i = 0; i < options.marginRows(); i++) {
            appendLine(out, blankGlyphs, blankKinds, options);
        }
        for (int row = 0; row < glyphs.length; row++) {
            appendLine(out, glyphs[row], kinds[row], options);
        }
        for (int i = 0; i < options.marginRows(); i++) {
            appendLine(out, blankGlyphs, blankKinds, options);
        }
        if (options.frame()) {
            appendBorder(out, width, options);
        }
        return out.toString();
    }

    private static void appendBorder(StringBuilder out, int width, RenderOptions options) {
        final var glyphs = new char[width + 2];
        final var kinds = new CellKind[width + 2];
        Arrays.fill(glyphs, FRAME_HORIZONTAL);
        Arrays.fill(kinds, CellKind.FRAME);
        glyphs[0] = FRAME_CORNER;
        glyphs[width + 1] = FRAME_CORNER;
        appendRuns(out, glyphs, kinds, options);
        out.append('\n');
    }

    private static void appendLine(StringBuilder out, char[] glyphs, CellKind[] kinds, RenderOptions options) {
        if (!options.frame()) {
            appendRuns(out, glyphs, kinds, options);
            out.append('\n');
            return;
        }
        final var framedGlyphs = new char[glyphs.length + 2];
        final var framedKinds = new CellKind[kinds.length + 2];
        System.arraycopy(glyphs, 0, framedGlyphs, 1, glyphs.length);
        System.arraycopy(kinds, 0, framedKinds, 1, kinds.length);
        framedGlyphs[0] = FRAME_VERTICAL;
        framedGlyphs[framedGlyphs.length - 1] = FRAME_VERTICAL;
        framedKinds[0] = CellKind.FRAME;
        framedKinds[framedKinds.length - 1] = CellKind.FRAME;
        appendRuns(out, framedGlyphs, framedKinds, options);
        out.append('\n');
    }

    // Consecutive cells of the same colour share one escape sequence.
    private static void appendRuns(StringBuilder out, char[] glyphs, CellKind[] kinds, RenderOptions options) {
        if (!options.colorized()) {
            out.append(glyphs);
            return;
        }
        var active = AnsiColor.DEFAULT;
        for (int i = 0; i < glyphs.length; i++) {
            final var color = colorOf(kinds[i], options);
            if (color != active) {
                out.append(active.resetSequence());
                out.append(color.startSequence());
                active = color;
            }
            out.append(glyphs[i]);
        }
        out.append(active.resetSequence());
    }

    private static AnsiColor colorOf(CellKind kind, RenderOptions options) {
        return switch (kind) {
            case LAND -> options.mapColor();
            case MARKER -> options.markerColor();
            case FRAME -> options.frameColor();
            case WATER -> AnsiColor.DEFAULT;
        };
    }

    private static int clamp(int value, int size) {
        return Math.max(0, Math.min(size - 1, value));
    }
}
