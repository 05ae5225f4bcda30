package asciimap.core.port.out;

import java.time.Instant;

/**
 * Port interface for per-client request admission.
 *
 * <p>Implementations own their synchronization. Every call must appear atomic with respect
 * to the client bucket it touches.
 */
public interface RateLimiter {

    /**
     * Key shared by every client that cannot be identified.
     */
    String ANONYMOUS_KEY = "anonymous";

    /**
     * Admit or reject one request from {@code clientKey}.
     *
     * <p>Admission consumes one slot of the client's current window; rejection leaves state untouched.
     *
     * @param clientKey the client identifier; null or blank maps to {@link #ANONYMOUS_KEY}
     * @param now       the time of the request
     * @return true if the request is admitted
     */
    boolean allow(String clientKey, Instant now);
}
