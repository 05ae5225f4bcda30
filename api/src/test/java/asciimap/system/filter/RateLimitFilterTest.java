package asciimap.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import jakarta.enterprise.inject.Instance;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import asciimap.adapter.in.dto.ErrorResponse;
import asciimap.core.port.out.RateLimiter;
import asciimap.core.service.ratelimit.ClientKeyResolver;

@DisplayName("RateLimitFilter")
class RateLimitFilterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private RateLimitFilter filter;
    private RateLimiter rateLimiter;
    private Instance<HttpServerRequest> httpRequestInstance;
    private HttpServerRequest httpRequest;
    private ContainerRequestContext requestContext;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        rateLimiter = mock(RateLimiter.class);
        httpRequestInstance = mock(Instance.class);
        httpRequest = mock(HttpServerRequest.class);
        requestContext = mock(ContainerRequestContext.class);

        when(httpRequestInstance.isResolvable()).thenReturn(true);
        when(httpRequestInstance.get()).thenReturn(httpRequest);
        when(httpRequest.remoteAddress()).thenReturn(SocketAddress.inetSocketAddress(54321, "192.0.2.10"));

        filter = new RateLimitFilter(
                rateLimiter, new ClientKeyResolver(), httpRequestInstance, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("should let admitted requests through")
        void shouldLetAdmittedRequestsThrough() {
            when(rateLimiter.allow(anyString(), any())).thenReturn(true);

            filter.filter(requestContext);

            verify(requestContext, never()).abortWith(any());
        }

        @Test
        @DisplayName("should abort rejected requests with 429")
        void shouldAbortRejectedRequests() {
            when(rateLimiter.allow(anyString(), any())).thenReturn(false);

            filter.filter(requestContext);

            ArgumentCaptor<Response> responseCaptor = ArgumentCaptor.forClass(Response.class);
            verify(requestContext).abortWith(responseCaptor.capture());
            var response = responseCaptor.getValue();
            assertEquals(429, response.getStatus());
            assertEquals(new ErrorResponse("rate limit exceeded"), response.getEntity());
        }

        @Test
        @DisplayName("should consult the limiter with the current time")
        void shouldPassCurrentTime() {
            when(rateLimiter.allow(anyString(), any())).thenReturn(true);

            filter.filter(requestContext);

            verify(rateLimiter).allow("192.0.2.10", NOW);
        }
    }

    @Nested
    @DisplayName("Client identification")
    class ClientIdentificationTests {

        @Test
        @DisplayName("should key on the first X-Forwarded-For entry")
        void shouldUseForwardedFor() {
            when(requestContext.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.9, 10.0.0.1");
            when(requestContext.getHeaderString("X-Real-IP")).thenReturn("198.51.100.1");
            when(rateLimiter.allow(anyString(), any())).thenReturn(true);

            filter.filter(requestContext);

            verify(rateLimiter).allow(eq("203.0.113.9"), any());
        }

        @Test
        @DisplayName("should key on X-Real-IP when X-Forwarded-For is missing")
        void shouldUseRealIp() {
            when(requestContext.getHeaderString("X-Real-IP")).thenReturn("198.51.100.1");
            when(rateLimiter.allow(anyString(), any())).thenReturn(true);

            filter.filter(requestContext);

            verify(rateLimiter).allow(eq("198.51.100.1"), any());
        }

        @Test
        @DisplayName("should fall back to anonymous without a connection address")
        void shouldFallBackToAnonymous() {
            when(httpRequestInstance.isResolvable()).thenReturn(false);
            when(rateLimiter.allow(anyString(), any())).thenReturn(true);

            filter.filter(requestContext);

            verify(rateLimiter).allow(eq(RateLimiter.ANONYMOUS_KEY), any());
        }
    }
}
