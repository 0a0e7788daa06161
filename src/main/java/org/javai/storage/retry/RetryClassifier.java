package org.javai.storage.retry;

import org.javai.storage.error.ErrorDetail;
import org.javai.storage.error.ServiceErrorKind;
import org.javai.storage.error.ServiceException;
import org.javai.storage.error.TransportErrorKind;
import org.javai.storage.error.TransportException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether a failed storage request should be retried.
 *
 * <p>Stateless and safe to call from any thread. It never throws and never logs:
 * anything it does not recognise is not retryable. How often and how long to retry
 * is up to the {@link RetryPolicy} driving the attempts.
 */
public final class RetryClassifier {

    /**
     * Sub-error reasons that mark a structured service error as retryable.
     */
    public static final Set<String> RETRYABLE_REASONS = Set.of(
            "rateLimitExceeded",
            "backendError",
            "internalError",
            "badGateway",
            "serviceUnavailable"
    );

    /**
     * Response kinds that mark a service error without sub-errors as retryable.
     */
    public static final Set<ServiceErrorKind> UNSTRUCTURED_RETRYABLE_KINDS = Collections.unmodifiableSet(EnumSet.of(
            ServiceErrorKind.TOO_MANY_REQUESTS,
            ServiceErrorKind.INTERNAL_SERVER_ERROR,
            ServiceErrorKind.BAD_GATEWAY,
            ServiceErrorKind.SERVICE_UNAVAILABLE
    ));

    /**
     * {@link #isRetryable(Throwable)} as a predicate for retry drivers.
     */
    public static final Predicate<Throwable> PREDICATE = RetryClassifier::isRetryable;

    private RetryClassifier() {
    }

    /**
     * @param error The error raised by a request attempt (may be null)
     * @return true if another attempt may succeed
     */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof ServiceException serviceError) {
            return isRetryableServiceError(serviceError);
        }
        if (error instanceof TransportException transportError) {
            return isConnectionReset(transportError);
        }
        return false;
    }

    private static boolean isRetryableServiceError(ServiceException error) {
        List<ErrorDetail> errors = error.errors();
        if (errors.isEmpty()) {
            // No envelope, e.g. a response from a front-end proxy
            return UNSTRUCTURED_RETRYABLE_KINDS.contains(error.kind());
        }
        // Only the first sub-error decides
        return RETRYABLE_REASONS.contains(errors.get(0).reason());
    }

    /**
     * A connection error caused by a protocol error caused by a reset from the peer.
     */
    static boolean isConnectionReset(TransportException error) {
        return error.is(TransportErrorKind.CONNECTION)
                && error.underlying()
                        .filter(protocol -> protocol.is(TransportErrorKind.PROTOCOL))
                        .flatMap(TransportException::underlying)
                        .filter(signal -> signal.is(TransportErrorKind.CONNECTION_RESET))
                        .isPresent();
    }
}
