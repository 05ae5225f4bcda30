package asciimap.core.model.generate;

import java.util.Locale;
import java.util.Optional;

import com.google.common.base.CharMatcher;

/**
 * The 16-colour ANSI palette plus {@link #DEFAULT}, which leaves the terminal colour untouched.
 */
public enum AnsiColor {
    DEFAULT("", -1),
    BLACK("black", 30),
    RED("red", 31),
    GREEN("green", 32),
    YELLOW("yellow", 33),
    BLUE("blue", 34),
    MAGENTA("magenta", 35),
    CYAN("cyan", 36),
    WHITE("white", 37),
    BRIGHT_BLACK("bright-black", 90),
    BRIGHT_RED("bright-red", 91),
    BRIGHT_GREEN("bright-green", 92),
    BRIGHT_YELLOW("bright-yellow", 93),
    BRIGHT_BLUE("bright-blue", 94),
    BRIGHT_MAGENTA("bright-magenta", 95),
    BRIGHT_CYAN("bright-cyan", 96),
    BRIGHT_WHITE("bright-white", 97);

    private static final String ESC = "\u001B[";

    private final String wireName;
    private final int sgrCode;

    AnsiColor(String wireName, int sgrCode) {
        this.wireName = wireName;
        this.sgrCode = sgrCode;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isDefault() {
        return this == DEFAULT;
    }

    /**
     * SGR sequence that switches the foreground to this colour, or an empty string for {@link #DEFAULT}.
     */
    public String startSequence() {
        return isDefault() ? "" : ESC + sgrCode + "m";
    }

    /**
     * SGR sequence that resets attributes, or an empty string for {@link #DEFAULT}.
     */
    public String resetSequence() {
        return isDefault() ? "" : ESC + "0m";
    }

    /**
     * Resolve a palette entry from its wire name, ignoring case and surrounding Unicode whitespace.
     * An empty or blank name resolves to {@link #DEFAULT}.
     *
     * @param value the raw value, may be null
     * @return the colour, or empty if the name is not in the palette
     */
    public static Optional<AnsiColor> fromWireName(String value) {
        if (value == null) {
            return Optional.of(DEFAULT);
        }
        final var normalized = CharMatcher.whitespace().trimFrom(value).toLowerCase(Locale.ROOT);
        for (var color : values()) {
            if (color.wireName.equals(normalized)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }
}
