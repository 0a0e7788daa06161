package org.javai.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A classified failure of one storage call attempt, ready for retry policy evaluation
 * and reporting.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type Whether a retry may help
 * @param exception The error that was raised (may be null)
 * @param retryAfter Server-suggested delay before the next attempt (may be null)
 * @param operation The storage operation that failed (e.g., "objects.get")
 * @param occurredAt When the failure was classified
 * @param tags Additional key-value metadata for observability, in insertion order
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        Duration retryAfter,
        String operation,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /**
     * Creates a transient failure that may resolve on retry.
     */
    public static Failure transientFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.TRANSIENT, exception, null,
                operation, Instant.now(), null);
    }

    /**
     * Creates a transient failure with a server-suggested retry delay.
     */
    public static Failure transientFailure(FailureId id, String message, String operation, Throwable exception,
                                           Duration retryAfter) {
        return new Failure(id, message, FailureType.TRANSIENT, exception, retryAfter,
                operation, Instant.now(), null);
    }

    /**
     * Creates a permanent failure that will not resolve on retry.
     */
    public static Failure permanentFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.PERMANENT, exception, null,
                operation, Instant.now(), null);
    }

    /**
     * Creates a defect failure (programming error or misconfiguration).
     */
    public static Failure defect(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.DEFECT, exception, null,
                operation, Instant.now(), null);
    }

    public boolean isTransient() {
        return type == FailureType.TRANSIENT;
    }

    /**
     * Returns a copy of this failure with the given tags.
     */
    public Failure withTags(Map<String, String> tags) {
        return new Failure(id, message, type, exception, retryAfter, operation, occurredAt, tags);
    }
}
