package asciimap.core.port.out;

import asciimap.core.model.render.LandMask;

/**
 * Port interface for loading the land mask backing the renderer.
 */
public interface LandMaskLoader {

    /**
     * Load the mask.
     *
     * @return the mask
     * @throws IllegalStateException if the backing data is missing or corrupt
     */
    LandMask load();

    /**
     * Human-readable description of where the mask comes from, for logs.
     */
    String source();
}
