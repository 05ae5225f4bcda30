package asciimap.core.service.generate;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.base.CharMatcher;

import asciimap.core.model.common.ValidationResult;
import asciimap.core.model.generate.AnsiColor;
import asciimap.core.model.generate.ColorConfig;
import asciimap.core.model.generate.ColorMode;
import asciimap.core.model.generate.GenerateConfig;
import asciimap.core.model.generate.GenerateLimits;
import asciimap.core.model.generate.GenerateRequest;
import asciimap.core.model.generate.Marker;

/**
 * Bounds-checks decoded generate requests and normalizes them into {@link GenerateConfig}.
 *
 * <p>Checks run in a fixed order and the first violation is reported:
 * width, supersample, margin, char_aspect, color.mode, color.map_color,
 * color.frame_color, color.marker_color, then, only for an enabled marker,
 * lon, lat, arm lengths and the three glyphs.
 *
 * <p>The validator is stateless; the same request and limits always give the same result.
 */
@ApplicationScoped
public class GenerateRequestValidator {

    private final GenerateLimits limits;

    @Inject
    public GenerateRequestValidator(GenerateLimits limits) {
        this.limits = limits;
    }

    public ValidationResult validate(GenerateRequest request) {
        if (request.width() < limits.minWidth() || request.width() > limits.maxWidth()) {
            return ValidationResult.invalid(
                    "width must be between %d and %d", limits.minWidth(), limits.maxWidth());
        }
        if (request.supersample() < limits.minSupersample() || request.supersample() > limits.maxSupersample()) {
            return ValidationResult.invalid(
                    "supersample must be between %d and %d", limits.minSupersample(), limits.maxSupersample());
        }
        if (request.margin() < 0 || request.margin() > limits.maxMargin()) {
            return ValidationResult.invalid("margin must be between 0 and %d", limits.maxMargin());
        }
        final var charAspect = request.charAspect();
        if (!Double.isFinite(charAspect)
                || charAspect < limits.minCharAspect()
                || charAspect > limits.maxCharAspect()) {
            return ValidationResult.invalid(
                    "char_aspect must be between %.1f and %.1f", limits.minCharAspect(), limits.maxCharAspect());
        }

        final var colorRequest = request.color();
        final var mode = ColorMode.fromWireName(colorRequest.mode());
        if (mode.isEmpty()) {
            return ValidationResult.invalid("color.mode must be one of: never, always");
        }
        final var mapColor = AnsiColor.fromWireName(colorRequest.mapColor());
        if (mapColor.isEmpty()) {
            return unsupportedColor("color.map_color");
        }
        final var frameColor = AnsiColor.fromWireName(colorRequest.frameColor());
        if (frameColor.isEmpty()) {
            return unsupportedColor("color.frame_color");
        }
        final var markerColor = AnsiColor.fromWireName(colorRequest.markerColor());
        if (markerColor.isEmpty()) {
            return unsupportedColor("color.marker_color");
        }
        final var color = new ColorConfig(mode.get(), mapColor.get(), frameColor.get(), markerColor.get());

        final var markerRequest = request.marker();
        if (!markerRequest.enabled()) {
            return ValidationResult.valid(toConfig(request, Optional.empty(), color));
        }

        final var lon = markerRequest.lon();
        if (!Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            return ValidationResult.invalid("marker.lon must be between -180 and 180");
        }
        final var lat = markerRequest.lat();
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            return ValidationResult.invalid("marker.lat must be between -90 and 90");
        }
        if (markerRequest.armX() < Marker.UNBOUNDED_ARM || markerRequest.armY() < Marker.UNBOUNDED_ARM) {
            return ValidationResult.invalid("marker arm lengths must be -1 or greater");
        }

        final var center = parseGlyph(markerRequest.center(), Marker.DEFAULT_CENTER, "marker.center");
        if (center instanceof GlyphParse.Rejected rejected) {
            return ValidationResult.invalid(rejected.reason());
        }
        final var horizontal =
                parseGlyph(markerRequest.horizontal(), Marker.DEFAULT_HORIZONTAL, "marker.horizontal");
        if (horizontal instanceof GlyphParse.Rejected rejected) {
            return ValidationResult.invalid(rejected.reason());
        }
        final var vertical = parseGlyph(markerRequest.vertical(), Marker.DEFAULT_VERTICAL, "marker.vertical");
        if (vertical instanceof GlyphParse.Rejected rejected) {
            return ValidationResult.invalid(rejected.reason());
        }

        final var marker = new Marker(
                lon,
                lat,
                ((GlyphParse.Accepted) center).glyph(),
                ((GlyphParse.Accepted) horizontal).glyph(),
                ((GlyphParse.Accepted) vertical).glyph(),
                markerRequest.armX(),
                markerRequest.armY());
        return ValidationResult.valid(toConfig(request, Optional.of(marker), color));
    }

    public GenerateLimits limits() {
        return limits;
    }

    private static GenerateConfig toConfig(GenerateRequest request, Optional<Marker> marker, ColorConfig color) {
        return new GenerateConfig(
                request.width(),
                request.supersample(),
                request.charAspect(),
                request.margin(),
                request.frame(),
                marker,
                color);
    }

    private static ValidationResult unsupportedColor(String field) {
        return ValidationResult.invalid("%s is not a supported ANSI 16 color", field);
    }

    /**
     * Parse a single-glyph field. Blank falls back to the default glyph; control characters are kept.
     */
    static GlyphParse parseGlyph(String value, char fallback, String field) {
        final var trimmed = value == null ? "" : CharMatcher.whitespace().trimFrom(value);
        if (trimmed.isEmpty()) {
            return new GlyphParse.Accepted(fallback);
        }
        if (trimmed.codePointCount(0, trimmed.length()) != 1) {
            return new GlyphParse.Rejected(field + " must be a single ASCII character");
        }
        final var codePoint = trimmed.codePointAt(0);
        if (codePoint > 127) {
            return new GlyphParse.Rejected(field + " must be ASCII");
        }
        return new GlyphParse.Accepted((char) codePoint);
    }

    sealed interface GlyphParse {

        record Accepted(char glyph) implements GlyphParse {}

        record Rejected(String reason) implements GlyphParse {}
    }
}
