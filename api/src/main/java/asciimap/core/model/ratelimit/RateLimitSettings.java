package asciimap.core.model.ratelimit;

import java.time.Duration;

/**
 * Fixed-window rate limit: at most {@code limit} requests per client per {@code window}.
 *
 * <p>Non-positive values are replaced with one request per minute; construction never fails.
 */
public record RateLimitSettings(int limit, Duration window) {

    public static final int DEFAULT_LIMIT = 20;
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    static final int FALLBACK_LIMIT = 1;
    static final Duration FALLBACK_WINDOW = Duration.ofMinutes(1);

    public RateLimitSettings {
        if (limit <= 0) {
            limit = FALLBACK_LIMIT;
        }
        if (window == null || window.isZero() || window.isNegative()) {
            window = FALLBACK_WINDOW;
        }
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(DEFAULT_LIMIT, DEFAULT_WINDOW);
    }
}
