package asciimap.core.model.generate;

import java.util.Objects;
import java.util.Optional;

/**
 * A validated, render-ready generate request.
 *
 * <p>Instances are only produced by the request validator, so every field is within the
 * configured bounds. The marker is absent when the request disabled it.
 */
public record GenerateConfig(
        int width,
        int supersample,
        double charAspect,
        int margin,
        boolean frame,
        Optional<Marker> marker,
        ColorConfig color) {

    public GenerateConfig {
        marker = Objects.requireNonNullElse(marker, Optional.empty());
        Objects.requireNonNull(color, "color must not be null");
    }
}
