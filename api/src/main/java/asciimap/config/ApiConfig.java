package asciimap.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.runtime.configuration.DurationConverter;
import io.quarkus.runtime.configuration.MemorySizeConverter;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import asciimap.adapter.out.render.ClasspathLandMaskLoader;
import asciimap.core.model.generate.GenerateLimits;
import asciimap.core.model.ratelimit.RateLimitSettings;

/**
 * Service configuration.
 *
 * <p>Configuration prefix: {@code asciimap}
 *
 * <p>Values are read once at startup. A value that is unset falls back to its default; a value that
 * cannot be parsed logs a warning and falls back as well, so a typo in a tuning knob never stops
 * the service from starting.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code API_MIN_WIDTH} / {@code API_MAX_WIDTH} - accepted width range (20..240)</li>
 *   <li>{@code API_MIN_SUPERSAMPLE} / {@code API_MAX_SUPERSAMPLE} - accepted supersample range (1..5)</li>
 *   <li>{@code API_MIN_CHAR_ASPECT} / {@code API_MAX_CHAR_ASPECT} - accepted char aspect range (1.0..3.5)</li>
 *   <li>{@code API_MAX_MARGIN} - largest accepted margin (12)</li>
 *   <li>{@code API_RATE_LIMIT} - requests per client per window (20)</li>
 *   <li>{@code API_RATE_WINDOW} - window length, e.g. {@code 30s}, {@code 1m} (1m)</li>
 *   <li>{@code API_MAX_BODY_BYTES} - largest accepted request body (65536), capped at
 *       {@code quarkus.http.limits.max-body-size}</li>
 * </ul>
 */
@ApplicationScoped
public class ApiConfig {

    static final String MIN_WIDTH = "asciimap.limits.min-width";
    static final String MAX_WIDTH = "asciimap.limits.max-width";
    static final String MIN_SUPERSAMPLE = "asciimap.limits.min-supersample";
    static final String MAX_SUPERSAMPLE = "asciimap.limits.max-supersample";
    static final String MIN_CHAR_ASPECT = "asciimap.limits.min-char-aspect";
    static final String MAX_CHAR_ASPECT = "asciimap.limits.max-char-aspect";
    static final String MAX_MARGIN = "asciimap.limits.max-margin";
    static final String RATE_LIMIT = "asciimap.rate-limiting.limit";
    static final String RATE_WINDOW = "asciimap.rate-limiting.window";
    static final String MAX_BODY_BYTES = "asciimap.http.max-body-bytes";
    static final String LAND_MASK_RESOURCE = "asciimap.land-mask.resource";
    static final String TRANSPORT_MAX_BODY_SIZE = "quarkus.http.limits.max-body-size";

    static final int DEFAULT_MAX_BODY_BYTES = 64 * 1024;
    // Quarkus default for quarkus.http.limits.max-body-size (10240K)
    static final long DEFAULT_TRANSPORT_MAX_BODY_BYTES = 10240L * 1024;

    private static final Logger LOG = Logger.getLogger(ApiConfig.class);

    private final GenerateLimits limits;
    private final RateLimitSettings rateLimiting;
    private final long maxBodyBytes;
    private final String landMaskResource;

    @Inject
    public ApiConfig(Config config) {
        this.limits = new GenerateLimits(
                readInt(config, MIN_WIDTH, GenerateLimits.DEFAULT_MIN_WIDTH),
                readInt(config, MAX_WIDTH, GenerateLimits.DEFAULT_MAX_WIDTH),
                readInt(config, MIN_SUPERSAMPLE, GenerateLimits.DEFAULT_MIN_SUPERSAMPLE),
                readInt(config, MAX_SUPERSAMPLE, GenerateLimits.DEFAULT_MAX_SUPERSAMPLE),
                readDouble(config, MIN_CHAR_ASPECT, GenerateLimits.DEFAULT_MIN_CHAR_ASPECT),
                readDouble(config, MAX_CHAR_ASPECT, GenerateLimits.DEFAULT_MAX_CHAR_ASPECT),
                readInt(config, MAX_MARGIN, GenerateLimits.DEFAULT_MAX_MARGIN));
        this.rateLimiting = new RateLimitSettings(
                readInt(config, RATE_LIMIT, RateLimitSettings.DEFAULT_LIMIT),
                readDuration(config, RATE_WINDOW, RateLimitSettings.DEFAULT_WINDOW));
        this.maxBodyBytes = capBodyBytes(
                readInt(config, MAX_BODY_BYTES, DEFAULT_MAX_BODY_BYTES),
                readMemorySize(config, TRANSPORT_MAX_BODY_SIZE, DEFAULT_TRANSPORT_MAX_BODY_BYTES));
        this.landMaskResource =
                readString(config, LAND_MASK_RESOURCE).orElse(ClasspathLandMaskLoader.DEFAULT_RESOURCE);
    }

    public GenerateLimits limits() {
        return limits;
    }

    public RateLimitSettings rateLimiting() {
        return rateLimiting;
    }

    public long maxBodyBytes() {
        return maxBodyBytes;
    }

    public String landMaskResource() {
        return landMaskResource;
    }

    @Produces
    @Singleton
    GenerateLimits produceGenerateLimits() {
        return limits;
    }

    @Produces
    @Singleton
    RateLimitSettings produceRateLimitSettings() {
        return rateLimiting;
    }

    private static Optional<String> readString(Config config, String key) {
        return config.getOptionalValue(key, String.class).map(String::strip).filter(v -> !v.isEmpty());
    }

    static int readInt(Config config, String key, int fallback) {
        final var raw = readString(config, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.get());
        } catch (NumberFormatException e) {
            LOG.warnv("Invalid integer for {0} (\"{1}\"), using fallback {2}", key, raw.get(), fallback);
            return fallback;
        }
    }

    static double readDouble(Config config, String key, double fallback) {
        final var raw = readString(config, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.get());
        } catch (NumberFormatException e) {
            LOG.warnv(
                    "Invalid float for {0} (\"{1}\"), using fallback {2}",
                    key,
                    raw.get(),
                    String.format(Locale.ROOT, "%.2f", fallback));
            return fallback;
        }
    }

    /**
     * Bodies above the transport limit are refused by Vert.x with a bare 413 before they reach the
     * decoder, so the application cap never exceeds it.
     */
    static long capBodyBytes(long configured, long transportLimit) {
        if (configured > transportLimit) {
            LOG.warnv(
                    "{0}={1} exceeds {2}={3}, capping the request body limit at {3}",
                    MAX_BODY_BYTES,
                    configured,
                    TRANSPORT_MAX_BODY_SIZE,
                    transportLimit);
            return transportLimit;
        }
        return configured;
    }

    static long readMemorySize(Config config, String key, long fallback) {
        final var raw = readString(config, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return new MemorySizeConverter().convert(raw.get()).asLongValue();
        } catch (IllegalArgumentException e) {
            LOG.warnv("Invalid memory size for {0} (\"{1}\"), using fallback {2}", key, raw.get(), fallback);
            return fallback;
        }
    }

    static Duration readDuration(Config config, String key, Duration fallback) {
        final var raw = readString(config, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return DurationConverter.parseDuration(raw.get());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            LOG.warnv("Invalid duration for {0} (\"{1}\"), using fallback {2}", key, raw.get(), fallback);
            return fallback;
        }
    }
}
