package asciimap.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import asciimap.core.model.ratelimit.RateLimitSettings;
import asciimap.core.port.out.RateLimiter;

@DisplayName("InMemoryFixedWindowRateLimiter")
class InMemoryFixedWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryFixedWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        rateLimiter = new InMemoryFixedWindowRateLimiter(new RateLimitSettings(3, Duration.ofMinutes(1)));
    }

    @Nested
    @DisplayName("Basic operations")
    class BasicOperationTests {

        @Test
        @DisplayName("should admit up to the limit and reject the next request")
        void shouldAdmitUpToLimit() {
            for (int i = 0; i < 3; i++) {
                assertTrue(rateLimiter.allow("10.0.0.1", T0.plusSeconds(i)), "Request " + (i + 1) + " should be allowed");
            }

            assertFalse(rateLimiter.allow("10.0.0.1", T0.plusSeconds(3)));
        }

        @Test
        @DisplayName("should track separate buckets per client")
        void shouldTrackSeparateBucketsPerClient() {
            for (int i = 0; i < 3; i++) {
                rateLimiter.allow("10.0.0.1", T0);
            }

            assertFalse(rateLimiter.allow("10.0.0.1", T0));
            assertTrue(rateLimiter.allow("10.0.0.2", T0));
            assertEquals(2, rateLimiter.getBucketCount());
        }

        @Test
        @DisplayName("should not count rejected requests")
        void shouldNotCountRejectedRequests() {
            for (int i = 0; i < 10; i++) {
                rateLimiter.allow("10.0.0.1", T0);
            }

            // A fresh window admits the full limit again
            for (int i = 0; i < 3; i++) {
                assertTrue(rateLimiter.allow("10.0.0.1", T0.plus(Duration.ofMinutes(1))));
            }
        }
    }

    @Nested
    @DisplayName("Window boundaries")
    class WindowBoundaryTests {

        @Test
        @DisplayName("should open a fresh window once the full window has elapsed")
        void shouldResetAtExactWindowBoundary() {
            for (int i = 0; i < 3; i++) {
                rateLimiter.allow("10.0.0.1", T0);
            }

            assertFalse(rateLimiter.allow("10.0.0.1", T0.plus(Duration.ofSeconds(59))));
            assertTrue(rateLimiter.allow("10.0.0.1", T0.plus(Duration.ofSeconds(60))));
        }

        @Test
        @DisplayName("should admit more than the limit in a short span across a boundary")
        void shouldAllowBurstAcrossBoundary() {
            rateLimiter.allow("10.0.0.1", T0);

            var admitted = 0;
            for (int i = 0; i < 2; i++) {
                if (rateLimiter.allow("10.0.0.1", T0.plus(Duration.ofSeconds(59)))) {
                    admitted++;
                }
            }
            for (int i = 0; i < 3; i++) {
                if (rateLimiter.allow("10.0.0.1", T0.plus(Duration.ofSeconds(60)))) {
                    admitted++;
                }
            }

            assertEquals(5, admitted);
        }

        @Test
        @DisplayName("window starts at the first request, not at a wall-clock boundary")
        void windowStartsAtFirstRequest() {
            rateLimiter.allow("10.0.0.1", T0.plusSeconds(30));
            rateLimiter.allow("10.0.0.1", T0.plusSeconds(31));
            rateLimiter.allow("10.0.0.1", T0.plusSeconds(32));

            assertFalse(rateLimiter.allow("10.0.0.1", T0.plusSeconds(89)));
            assertTrue(rateLimiter.allow("10.0.0.1", T0.plusSeconds(90)));
        }
    }

    @Nested
    @DisplayName("Anonymous clients")
    class AnonymousClientTests {

        @Test
        @DisplayName("should share one bucket between blank, null and anonymous keys")
        void shouldShareAnonymousBucket() {
            assertTrue(rateLimiter.allow("", T0));
            assertTrue(rateLimiter.allow(null, T0));
            assertTrue(rateLimiter.allow("   ", T0));

            assertFalse(rateLimiter.allow(RateLimiter.ANONYMOUS_KEY, T0));
            assertEquals(1, rateLimiter.getBucketCount());
        }
    }

    @Nested
    @DisplayName("Stale bucket sweep")
    class SweepTests {

        @Test
        @DisplayName("should drop buckets idle for two windows when a window opens")
        void shouldSweepStaleBuckets() {
            rateLimiter.allow("10.0.0.1", T0);
            rateLimiter.allow("10.0.0.2", T0);
            assertEquals(2, rateLimiter.getBucketCount());

            rateLimiter.allow("10.0.0.3", T0.plus(Duration.ofMinutes(2)));

            assertEquals(1, rateLimiter.getBucketCount());
        }

        @Test
        @DisplayName("should keep buckets younger than two windows")
        void shouldKeepRecentBuckets() {
            rateLimiter.allow("10.0.0.1", T0);
            rateLimiter.allow("10.0.0.2", T0.plus(Duration.ofSeconds(119)));

            assertEquals(2, rateLimiter.getBucketCount());
        }

        @Test
        @DisplayName("clear should remove all buckets")
        void clearShouldRemoveAllBuckets() {
            rateLimiter.allow("10.0.0.1", T0);
            rateLimiter.allow("10.0.0.2", T0);

            rateLimiter.clear();

            assertEquals(0, rateLimiter.getBucketCount());
            assertTrue(rateLimiter.allow("10.0.0.1", T0));
        }
    }

    @Nested
    @DisplayName("Settings")
    class SettingsTests {

        @Test
        @DisplayName("should fall back to one request per minute for non-positive settings")
        void shouldFallBackForNonPositiveSettings() {
            var limiter = new InMemoryFixedWindowRateLimiter(new RateLimitSettings(0, Duration.ZERO));

            assertEquals(1, limiter.limit());
            assertEquals(Duration.ofMinutes(1), limiter.window());
            assertTrue(limiter.allow("10.0.0.1", T0));
            assertFalse(limiter.allow("10.0.0.1", T0));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit exactly the limit under contention for one key")
        void shouldAdmitExactlyLimitUnderContention() throws Exception {
            var limiter = new InMemoryFixedWindowRateLimiter(new RateLimitSettings(50, Duration.ofMinutes(1)));
            int threads = 16;
            int requestsPerThread = 25;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var admitted = new AtomicInteger();
            var futures = new ArrayList<Future<?>>();

            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < requestsPerThread; i++) {
                            if (limiter.allow("10.0.0.1", T0)) {
                                admitted.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (var future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(50, admitted.get());
        }
    }
}
