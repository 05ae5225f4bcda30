package asciimap.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Request count for one client inside the window that started at {@code windowStart}.
 */
public record FixedWindowBucket(Instant windowStart, int count) {

    public static FixedWindowBucket open(Instant now) {
        return new FixedWindowBucket(now, 1);
    }

    public FixedWindowBucket increment() {
        return new FixedWindowBucket(windowStart, count + 1);
    }

    /**
     * Whether at least {@code window} has elapsed since this bucket's window started.
     */
    public boolean isExpired(Instant now, Duration window) {
        return Duration.between(windowStart, now).compareTo(window) >= 0;
    }
}
