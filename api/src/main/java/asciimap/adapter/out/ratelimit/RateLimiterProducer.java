package asciimap.adapter.out.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import asciimap.adapter.out.ratelimit.memory.InMemoryFixedWindowRateLimiter;
import asciimap.core.model.ratelimit.RateLimitSettings;
import asciimap.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>The limiter is created once per process from the startup settings and never reconfigured.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitSettings settings;

    @Inject
    public RateLimiterProducer(RateLimitSettings settings) {
        this.settings = settings;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the process-wide rate limiter
     */
    @Produces
    @Singleton
    public RateLimiter produceRateLimiter() {
        LOG.infov(
                "Rate limiting enabled with algorithm=FIXED_WINDOW, limit={0}/{1}",
                settings.limit(),
                settings.window());
        return new InMemoryFixedWindowRateLimiter(settings);
    }
}
