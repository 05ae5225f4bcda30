package asciimap.adapter.in.problem;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import asciimap.adapter.in.dto.ErrorResponse;

/**
 * A request-terminating error with a single human-readable message.
 *
 * <p>Provides static factory methods for each {@link ApiErrorKind}. Problems are turned into
 * {@code {"error": "..."}} responses by {@link GlobalExceptionMappers}.
 */
public final class ApiProblem extends RuntimeException {

    private final ApiErrorKind kind;

    private ApiProblem(ApiErrorKind kind, String message) {
        super(message, null, false, false);
        this.kind = kind;
    }

    public ApiErrorKind kind() {
        return kind;
    }

    public int status() {
        return kind.status();
    }

    public Response toResponse() {
        return Response.status(kind.status())
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(getMessage()))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static ApiProblem malformedPayload(String detail) {
        return new ApiProblem(ApiErrorKind.MALFORMED_PAYLOAD, "invalid JSON payload: " + detail);
    }

    public static ApiProblem validationFailed(String reason) {
        return new ApiProblem(ApiErrorKind.VALIDATION_FAILED, reason);
    }

    public static ApiProblem renderFailed(String detail) {
        return new ApiProblem(ApiErrorKind.RENDER_FAILED, detail);
    }

    // ========== Rate Limit Errors ==========

    public static ApiProblem rateLimited() {
        return new ApiProblem(ApiErrorKind.RATE_LIMITED, "rate limit exceeded");
    }

    // ========== Routing Errors ==========

    public static ApiProblem methodNotAllowed() {
        return new ApiProblem(ApiErrorKind.METHOD_NOT_ALLOWED, "method not allowed");
    }

    public static ApiProblem notFound() {
        return new ApiProblem(ApiErrorKind.NOT_FOUND, "not found");
    }
}
