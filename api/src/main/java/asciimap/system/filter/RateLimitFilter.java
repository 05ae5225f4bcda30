package asciimap.system.filter;

import java.time.Clock;
import java.time.Instant;

import jakarta.annotation.Priority;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;

import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import asciimap.adapter.in.problem.ApiProblem;
import asciimap.adapter.in.rest.RateLimited;
import asciimap.core.port.out.RateLimiter;
import asciimap.core.service.ratelimit.ClientKeyResolver;

/**
 * JAX-RS filter that enforces the per-client fixed-window rate limit.
 *
 * <p>Only applies to resource methods annotated with {@link RateLimited}. It runs after
 * routing, so requests with the wrong method are answered with 405 without consuming
 * budget, and before the request body is decoded.
 *
 * <p>Client identification priority:
 * <ol>
 * <li>First entry of X-Forwarded-For</li>
 * <li>X-Real-IP</li>
 * <li>Remote address of the connection</li>
 * <li>The shared anonymous bucket</li>
 * </ol>
 */
@Provider
@RateLimited
@Priority(Priorities.AUTHENTICATION - 50)
public class RateLimitFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";

    private final RateLimiter rateLimiter;
    private final ClientKeyResolver clientKeyResolver;
    private final Instance<HttpServerRequest> httpRequest;
    private final Clock clock;

    @Inject
    public RateLimitFilter(
            RateLimiter rateLimiter, ClientKeyResolver clientKeyResolver, Instance<HttpServerRequest> httpRequest) {
        this(rateLimiter, clientKeyResolver, httpRequest, Clock.systemUTC());
    }

    RateLimitFilter(
            RateLimiter rateLimiter,
            ClientKeyResolver clientKeyResolver,
            Instance<HttpServerRequest> httpRequest,
            Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clientKeyResolver = clientKeyResolver;
        this.httpRequest = httpRequest;
        this.clock = clock;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        final var clientKey = clientKeyResolver.resolve(
                requestContext.getHeaderString(FORWARDED_FOR),
                requestContext.getHeaderString(REAL_IP),
                remoteHost());

        if (!rateLimiter.allow(clientKey, Instant.now(clock))) {
            LOG.debugv("Rate limit exceeded for client {0}", clientKey);
            requestContext.abortWith(ApiProblem.rateLimited().toResponse());
        }
    }

    private String remoteHost() {
        if (!httpRequest.isResolvable()) {
            return null;
        }
        final var address = httpRequest.get().remoteAddress();
        return address == null ? null : address.host();
    }
}
