package asciimap.adapter.in.problem;

/**
 * Client-visible error kinds and the HTTP status each one maps to.
 */
public enum ApiErrorKind {
    MALFORMED_PAYLOAD(400),
    VALIDATION_FAILED(400),
    RENDER_FAILED(400),
    RATE_LIMITED(429),
    METHOD_NOT_ALLOWED(405),
    NOT_FOUND(404);

    private final int status;

    ApiErrorKind(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }
}
