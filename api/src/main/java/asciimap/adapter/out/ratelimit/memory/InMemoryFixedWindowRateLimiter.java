package asciimap.adapter.out.ratelimit.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import asciimap.core.model.ratelimit.FixedWindowBucket;
import asciimap.core.model.ratelimit.RateLimitSettings;
import asciimap.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>
 * Each client key owns a bucket holding the start of its current window and the number of
 * requests admitted in it. A request that finds no bucket, or a bucket whose window has
 * elapsed, opens a fresh window; otherwise it is admitted while the count is below the limit.
 *
 * <p>
 * Whenever a window is opened, buckets older than two windows are swept, so churn of
 * distinct keys does not grow the map without bound.
 *
 * <p>
 * Up to twice the limit can be admitted across a window boundary. That is inherent to
 * fixed windows.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 */
public final class InMemoryFixedWindowRateLimiter implements RateLimiter {

    private final Map<String, FixedWindowBucket> buckets;
    private final ReentrantLock lock;
    private final int limit;
    private final Duration window;
    private final Duration staleAfter;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param settings the limit and window; non-positive values are already corrected by
     *                 {@link RateLimitSettings}
     */
    public InMemoryFixedWindowRateLimiter(RateLimitSettings settings) {
        this.buckets = new HashMap<>();
        this.lock = new ReentrantLock();
        this.limit = settings.limit();
        this.window = settings.window();
        this.staleAfter = settings.window().multipliedBy(2);
    }

    @Override
    public boolean allow(String clientKey, Instant now) {
        final var key = clientKey == null || clientKey.isBlank() ? ANONYMOUS_KEY : clientKey;

        lock.lock();
        try {
            final var bucket = buckets.get(key);
            if (bucket == null || bucket.isExpired(now, window)) {
                buckets.put(key, FixedWindowBucket.open(now));
                sweep(now);
                return true;
            }

            if (bucket.count() >= limit) {
                return false;
            }

            buckets.put(key, bucket.increment());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int limit() {
        return limit;
    }

    public Duration window() {
        return window;
    }

    /**
     * Returns the current number of tracked client buckets.
     *
     * <p>
     * Useful for monitoring and testing.
     *
     * @return the number of buckets
     */
    public int getBucketCount() {
        lock.lock();
        try {
            return buckets.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears all rate limit state.
     *
     * <p>
     * Primarily for testing purposes.
     */
    public void clear() {
        lock.lock();
        try {
            buckets.clear();
        } finally {
            lock.unlock();
        }
    }

    // must hold lock
    private void sweep(Instant now) {
        buckets.values().removeIf(bucket -> bucket.isExpired(now, staleAfter));
    }
}
