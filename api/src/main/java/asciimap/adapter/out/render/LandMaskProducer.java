package asciimap.adapter.out.render;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import asciimap.config.ApiConfig;
import asciimap.core.model.render.LandMask;
import asciimap.core.port.out.LandMaskLoader;

/**
 * CDI producer for the land mask shared by all renders.
 *
 * <p>A mask that cannot be loaded is fatal: the exception propagates and the application
 * does not start serving.
 */
@ApplicationScoped
public class LandMaskProducer {

    private static final Logger LOG = Logger.getLogger(LandMaskProducer.class);

    private final ApiConfig config;

    @Inject
    public LandMaskProducer(ApiConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public LandMaskLoader produceLoader() {
        return new ClasspathLandMaskLoader(config.landMaskResource());
    }

    @Produces
    @Singleton
    public LandMask produceLandMask(LandMaskLoader loader) {
        try {
            final var mask = loader.load();
            LOG.infov("Loaded land mask from {0} ({1}x{2})", loader.source(), mask.columns(), mask.rows());
            return mask;
        } catch (IllegalStateException e) {
            LOG.errorv(e, "Failed to load land mask from {0}", loader.source());
            throw e;
        }
    }
}
