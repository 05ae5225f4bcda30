package asciimap.adapter.out.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.BitSet;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import asciimap.core.model.generate.AnsiColor;
import asciimap.core.model.generate.ColorConfig;
import asciimap.core.model.generate.ColorMode;
import asciimap.core.model.generate.Marker;
import asciimap.core.model.render.LandMask;
import asciimap.core.model.render.RenderException;
import asciimap.core.model.render.RenderOptions;

@DisplayName("AsciiMapRenderer")
class AsciiMapRendererTest {

    // Western hemisphere land, eastern hemisphere water
    private static final LandMask WEST_LAND = westLandMask();

    private final AsciiMapRenderer renderer = new AsciiMapRenderer();

    private static LandMask westLandMask() {
        var land = new BitSet();
        land.set(0);
        return new LandMask(2, 1, land);
    }

    private static String[] lines(String rendered) {
        return rendered.split("\n", -1);
    }

    @Nested
    @DisplayName("Geometry")
    class GeometryTests {

        @Test
        @DisplayName("should derive the row count from width and char aspect")
        void shouldDeriveRows() throws RenderException {
            var out = renderer.render(WEST_LAND, 20, 1, 2.0, Optional.empty(), RenderOptions.plain(0, false));

            var lines = lines(out);
            // trailing newline leaves an empty last element
            assertEquals(6, lines.length);
            assertEquals("", lines[5]);
            assertEquals("##########          ", lines[0]);
        }

        @Test
        @DisplayName("should pad with margin rows and draw a frame")
        void shouldDrawFrameAndMargin() throws RenderException {
            var out = renderer.render(WEST_LAND, 20, 2, 2.0, Optional.empty(), RenderOptions.plain(1, true));

            var lines = lines(out);
            assertEquals(2 + 2 + 5 + 1, lines.length);
            assertEquals("+" + "-".repeat(20) + "+", lines[0]);
            assertEquals("|" + " ".repeat(20) + "|", lines[1]);
            assertEquals("|##########          |", lines[2]);
            assertEquals("|" + " ".repeat(20) + "|", lines[7]);
            assertEquals("+" + "-".repeat(20) + "+", lines[8]);
        }

        @Test
        @DisplayName("should reject geometry that yields no rows")
        void shouldRejectEmptyGeometry() {
            var e = assertThrows(
                    RenderException.class,
                    () -> renderer.render(WEST_LAND, 1, 1, 3.0, Optional.empty(), RenderOptions.plain(0, false)));

            assertTrue(e.getMessage().contains("yields no rows"));
        }

        @Test
        @DisplayName("should reject non-positive parameters")
        void shouldRejectNonPositiveParameters() {
            var options = RenderOptions.plain(0, false);

            assertThrows(RenderException.class, () -> renderer.render(WEST_LAND, 0, 1, 2.0, Optional.empty(), options));
            assertThrows(RenderException.class, () -> renderer.render(WEST_LAND, 20, 0, 2.0, Optional.empty(), options));
            assertThrows(
                    RenderException.class,
                    () -> renderer.render(WEST_LAND, 20, 1, Double.NaN, Optional.empty(), options));
            assertThrows(RenderException.class, () -> renderer.render(null, 20, 1, 2.0, Optional.empty(), options));
        }
    }

    @Nested
    @DisplayName("Marker")
    class MarkerTests {

        @Test
        @DisplayName("should draw the centre and bounded arms")
        void shouldDrawBoundedArms() throws RenderException {
            var marker = new Marker(0, 0, 'O', '-', '|', 1, 1);

            var lines = lines(renderer.render(WEST_LAND, 20, 1, 2.0, Optional.of(marker), RenderOptions.plain(0, false)));

            assertEquals('O', lines[2].charAt(10));
            assertEquals('-', lines[2].charAt(9));
            assertEquals('-', lines[2].charAt(11));
            assertEquals('#', lines[2].charAt(8));
            assertEquals('|', lines[1].charAt(10));
            assertEquals('|', lines[3].charAt(10));
            assertEquals(' ', lines[0].charAt(10));
        }

        @Test
        @DisplayName("should span the whole row and column for unbounded arms")
        void shouldDrawUnboundedArms() throws RenderException {
            var marker = new Marker(0, 0, 'X', '=', '!', Marker.UNBOUNDED_ARM, Marker.UNBOUNDED_ARM);

            var lines = lines(renderer.render(WEST_LAND, 20, 1, 2.0, Optional.of(marker), RenderOptions.plain(0, false)));

            assertEquals("==========X=========", lines[2]);
            for (int row = 0; row < 5; row++) {
                if (row != 2) {
                    assertEquals('!', lines[row].charAt(10));
                }
            }
        }

        @Test
        @DisplayName("should clamp markers on the far edges into the grid")
        void shouldClampEdgeMarkers() throws RenderException {
            var marker = new Marker(180, -90, 'O', '-', '|', 0, 0);

            var lines = lines(renderer.render(WEST_LAND, 20, 1, 2.0, Optional.of(marker), RenderOptions.plain(0, false)));

            assertEquals('O', lines[4].charAt(19));
        }

        @Test
        @DisplayName("should reject markers outside the globe")
        void shouldRejectOutOfRangeMarker() {
            var marker = new Marker(200, 0, 'O', '-', '|', 0, 0);

            var e = assertThrows(
                    RenderException.class,
                    () -> renderer.render(WEST_LAND, 20, 1, 2.0, Optional.of(marker), RenderOptions.plain(0, false)));

            assertTrue(e.getMessage().contains("outside the renderable area"));
        }
    }

    @Nested
    @DisplayName("Colour")
    class ColorTests {

        @Test
        @DisplayName("should wrap land runs in the map colour")
        void shouldColorLandRuns() throws RenderException {
            var color = new ColorConfig(ColorMode.ALWAYS, AnsiColor.GREEN, AnsiColor.DEFAULT, AnsiColor.BRIGHT_RED);

            var lines = lines(renderer.render(
                    WEST_LAND, 20, 1, 2.0, Optional.empty(), RenderOptions.colored(0, false, color)));

            assertEquals("\u001B[32m##########\u001B[0m          ", lines[0]);
        }

        @Test
        @DisplayName("should colour the frame and leave water uncoloured")
        void shouldColorFrame() throws RenderException {
            var color = new ColorConfig(ColorMode.ALWAYS, AnsiColor.DEFAULT, AnsiColor.BRIGHT_WHITE, AnsiColor.DEFAULT);

            var lines = lines(renderer.render(
                    WEST_LAND, 20, 1, 2.0, Optional.empty(), RenderOptions.colored(0, true, color)));

            assertEquals("\u001B[97m+" + "-".repeat(20) + "+\u001B[0m", lines[0]);
            assertEquals("\u001B[97m|\u001B[0m##########          \u001B[97m|\u001B[0m", lines[1]);
        }

        @Test
        @DisplayName("should emit no escapes when colour mode is never")
        void shouldNotColorPlain() throws RenderException {
            var color = new ColorConfig(ColorMode.NEVER, AnsiColor.GREEN, AnsiColor.GREEN, AnsiColor.GREEN);

            var out = renderer.render(WEST_LAND, 20, 1, 2.0, Optional.empty(), RenderOptions.colored(1, true, color));

            assertFalse(out.contains("\u001B"));
        }
    }
}
