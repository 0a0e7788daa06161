package org.javai.storage.error;

/**
 * The kind of a service error response, derived from its HTTP status code.
 */
public enum ServiceErrorKind {

    BAD_REQUEST(400),
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    CONFLICT(409),
    PRECONDITION_FAILED(412),
    RANGE_NOT_SATISFIABLE(416),
    TOO_MANY_REQUESTS(429),
    INTERNAL_SERVER_ERROR(500),
    NOT_IMPLEMENTED(501),
    BAD_GATEWAY(502),
    SERVICE_UNAVAILABLE(503),
    GATEWAY_TIMEOUT(504),

    /** Any status code without a dedicated kind. */
    OTHER(-1);

    private final int statusCode;

    ServiceErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * The status code this kind stands for, or -1 for {@link #OTHER}.
     */
    public int statusCode() {
        return statusCode;
    }

    public static ServiceErrorKind fromStatus(int statusCode) {
        for (ServiceErrorKind kind : values()) {
            if (kind.statusCode == statusCode) {
                return kind;
            }
        }
        return OTHER;
    }
}
