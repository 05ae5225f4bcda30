package asciimap.core.model.generate;

import java.util.Objects;

/**
 * A successfully generated map.
 *
 * @param plain the uncoloured rendering
 * @param ansi  the colourised rendering, identical to {@code plain} when colour mode is never
 * @param meta  derived metadata
 */
public record GenerateResult(String plain, String ansi, GenerateMeta meta) {

    public GenerateResult {
        Objects.requireNonNull(plain, "plain must not be null");
        Objects.requireNonNull(ansi, "ansi must not be null");
        Objects.requireNonNull(meta, "meta must not be null");
    }
}
