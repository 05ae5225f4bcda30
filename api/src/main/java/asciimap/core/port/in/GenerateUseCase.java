package asciimap.core.port.in;

import io.smallrye.mutiny.Uni;

import asciimap.core.model.generate.GenerateConfig;
import asciimap.core.model.generate.GenerateOutcome;

/**
 * Use case for rendering a map from a validated configuration.
 *
 * <p>A plain variant is always rendered. A colourised variant is rendered as a second,
 * independent pass only when colour mode is always.
 */
public interface GenerateUseCase {

    /**
     * Render the map described by {@code config}.
     *
     * @param config the validated configuration
     * @return the generated result, or the render failure of whichever variant failed first
     */
    Uni<GenerateOutcome> generate(GenerateConfig config);
}
