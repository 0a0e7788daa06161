package org.javai.storage.retry;

import org.javai.storage.Failure;
import org.javai.storage.FailureId;
import org.javai.storage.FailureType;
import org.javai.storage.error.ErrorDetail;
import org.javai.storage.error.RetriesExhaustedException;
import org.javai.storage.error.ServiceException;
import org.javai.storage.error.TransportException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies storage errors using {@link RetryClassifier}.
 *
 * <p>Retryable errors become {@link FailureType#TRANSIENT} failures, any other I/O error a
 * {@link FailureType#PERMANENT} one. Runtime exceptions are defects. Failure ids are
 * <ul>
 *   <li>{@code storage:<reason>} for service errors with sub-errors</li>
 *   <li>{@code http:<kind>} for service errors without</li>
 *   <li>{@code transport:<kind>} for transport errors</li>
 * </ul>
 */
public class StorageFailureClassifier implements FailureClassifier {

    @Override
    public Failure classify(String operation, Throwable t) {
        if (t instanceof ServiceException serviceError) {
            return classifyServiceError(operation, serviceError);
        }
        if (t instanceof TransportException transportError) {
            return new Failure(
                    FailureId.of("transport", lowerCase(transportError.kind())),
                    messageFor(transportError),
                    typeFor(transportError),
                    transportError,
                    null,
                    operation,
                    Instant.now(),
                    Map.of("kind", transportError.kind().name()));
        }
        if (t instanceof RetriesExhaustedException exhausted) {
            return Failure.permanentFailure(
                    FailureId.of("retry", "exhausted"), messageFor(exhausted), operation, exhausted);
        }
        if (t instanceof IOException) {
            return Failure.permanentFailure(
                    FailureId.of("unknown", simpleName(t)), messageFor(t), operation, t);
        }
        return Failure.defect(FailureId.of("defect", simpleName(t)), messageFor(t), operation, t);
    }

    private static Failure classifyServiceError(String operation, ServiceException error) {
        FailureId id = error.firstError()
                .map(ErrorDetail::reason)
                .filter(reason -> !reason.isBlank())
                .map(reason -> FailureId.of("storage", reason))
                .orElseGet(() -> FailureId.of("http", lowerCase(error.kind())));

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("status", String.valueOf(error.statusCode()));
        tags.put("kind", error.kind().name());

        Duration retryAfter = error.retryAfter().orElse(null);
        return new Failure(id, messageFor(error), typeFor(error), error, retryAfter,
                operation, Instant.now(), tags);
    }

    private static FailureType typeFor(Throwable t) {
        return RetryClassifier.isRetryable(t) ? FailureType.TRANSIENT : FailureType.PERMANENT;
    }

    private static String lowerCase(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private static String simpleName(Throwable t) {
        String name = t.getClass().getSimpleName();
        return name.isEmpty() ? t.getClass().getName() : name;
    }

    private static String messageFor(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
