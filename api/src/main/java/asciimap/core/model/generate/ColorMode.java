package asciimap.core.model.generate;

import java.util.Locale;
import java.util.Optional;

import com.google.common.base.CharMatcher;

/**
 * Whether the renderer emits ANSI colour escapes.
 */
public enum ColorMode {
    NEVER("never"),
    ALWAYS("always");

    private final String wireName;

    ColorMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a mode from its wire name, ignoring case and surrounding Unicode whitespace.
     *
     * @param value the raw value, may be null
     * @return the mode, or empty if the value names no supported mode
     */
    public static Optional<ColorMode> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var normalized = CharMatcher.whitespace().trimFrom(value).toLowerCase(Locale.ROOT);
        for (var mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
