package org.javai.storage.error;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An error response returned by the storage service.
 *
 * <p>Carries the HTTP status and the ordered list of sub-errors from the response body.
 * The list is empty when the response had no structured envelope, as happens with
 * errors produced by front-end proxies rather than the service itself.
 */
public final class ServiceException extends StorageException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final ServiceErrorKind kind;
    private final transient List<ErrorDetail> errors;
    private final transient Duration retryAfter;

    public ServiceException(int statusCode, String message, List<ErrorDetail> errors) {
        this(statusCode, message, errors, null);
    }

    /**
     * @param statusCode HTTP status code of the response
     * @param message Human-readable description
     * @param errors Sub-errors in response order
     * @param retryAfter Delay requested by the server before retrying (may be null)
     */
    public ServiceException(int statusCode, String message, List<ErrorDetail> errors, Duration retryAfter) {
        super(Objects.requireNonNull(message, "message must not be null"));
        this.statusCode = statusCode;
        this.kind = ServiceErrorKind.fromStatus(statusCode);
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        this.retryAfter = retryAfter;
    }

    public int statusCode() {
        return statusCode;
    }

    public ServiceErrorKind kind() {
        return kind;
    }

    /**
     * The sub-errors in the order the service listed them. Never null, possibly empty.
     */
    public List<ErrorDetail> errors() {
        return errors;
    }

    public Optional<ErrorDetail> firstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String toString() {
        return "ServiceException{status=" + statusCode
                + ", kind=" + kind
                + ", reason=" + firstError().map(ErrorDetail::reason).orElse("none")
                + ", message=" + getMessage() + "}";
    }
}
