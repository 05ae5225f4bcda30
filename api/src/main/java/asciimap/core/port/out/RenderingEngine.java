package asciimap.core.port.out;

import java.util.Optional;

import asciimap.core.model.generate.Marker;
import asciimap.core.model.render.LandMask;
import asciimap.core.model.render.RenderException;
import asciimap.core.model.render.RenderOptions;

/**
 * Port interface for the ASCII map rasterizer.
 *
 * <p>Implementations must be safe for concurrent use; the mask is read-only.
 */
public interface RenderingEngine {

    /**
     * Project the mask and optional marker into a fixed-width character grid.
     *
     * @param mask        land/water mask to project
     * @param width       columns of the map area
     * @param supersample sub-samples per cell along each axis
     * @param charAspect  character height to width ratio
     * @param marker      marker to draw, if any
     * @param options     layout and colour options
     * @return the rendered text
     * @throws RenderException if the parameters cannot be rendered
     */
    String render(
            LandMask mask,
            int width,
            int supersample,
            double charAspect,
            Optional<Marker> marker,
            RenderOptions options)
            throws RenderException;
}
