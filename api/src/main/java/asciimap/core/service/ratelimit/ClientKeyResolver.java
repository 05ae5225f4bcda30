package asciimap.core.service.ratelimit;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.google.common.net.InetAddresses;

import asciimap.core.port.out.RateLimiter;

/**
 * Derives the rate-limit key for a request from its addressing information.
 *
 * <p>Preference order:
 * <ol>
 * <li>first entry of {@code X-Forwarded-For}</li>
 * <li>{@code X-Real-IP}</li>
 * <li>the transport remote address</li>
 * <li>{@value RateLimiter#ANONYMOUS_KEY}</li>
 * </ol>
 *
 * <p>Each candidate must be an IP literal, otherwise the next one is tried. The key is the
 * canonical text form of the address. Host names are never resolved.
 */
@ApplicationScoped
public class ClientKeyResolver {

    public String resolve(String forwardedFor, String realIp, String remoteHost) {
        return firstForwarded(forwardedFor)
                .flatMap(ClientKeyResolver::canonicalIp)
                .or(() -> canonicalIp(realIp))
                .or(() -> canonicalIp(remoteHost))
                .orElse(RateLimiter.ANONYMOUS_KEY);
    }

    private static Optional<String> firstForwarded(String forwardedFor) {
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(forwardedFor.split(",", -1)[0]);
    }

    static Optional<String> canonicalIp(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        var value = candidate.strip();
        // bracketed IPv6 literals are accepted
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        if (value.isEmpty() || !InetAddresses.isInetAddress(value)) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.toAddrString(InetAddresses.forString(value)));
    }
}
