package asciimap.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import asciimap.config.ApiConfig;
import asciimap.core.model.render.LandMask;

/**
 * Loads the land mask eagerly and logs the effective limits on application startup.
 *
 * <p>Injecting the mask here forces it to load before the first request; a load failure aborts
 * startup.
 */
@ApplicationScoped
public class StartupReporter {

    private static final Logger LOG = Logger.getLogger(StartupReporter.class);

    private final ApiConfig config;
    private final LandMask landMask;
    private final String host;
    private final int port;

    @Inject
    public StartupReporter(
            ApiConfig config,
            LandMask landMask,
            @ConfigProperty(name = "quarkus.http.host", defaultValue = "0.0.0.0") String host,
            @ConfigProperty(name = "quarkus.http.port", defaultValue = "8081") int port) {
        this.config = config;
        this.landMask = landMask;
        this.host = host;
        this.port = port;
    }

    void onStart(@Observes StartupEvent event) {
        final var limits = config.limits();
        final var rate = config.rateLimiting();
        LOG.infof("api listening on %s:%d", host, port);
        LOG.infof(
                "limits: width=%d..%d supersample=%d..%d margin<=%d rate=%d/%s",
                limits.minWidth(),
                limits.maxWidth(),
                limits.minSupersample(),
                limits.maxSupersample(),
                limits.maxMargin(),
                rate.limit(),
                rate.window());
        LOG.debugf("land mask ready: %dx%d", landMask.columns(), landMask.rows());
    }
}
