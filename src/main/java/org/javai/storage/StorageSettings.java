package org.javai.storage;

import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Resolves client settings from system properties, then environment variables,
 * then built-in defaults.
 *
 * <ul>
 *   <li>{@code storage.request.timeout.seconds} / {@code STORAGE_REQUEST_TIMEOUT_SECONDS}
 *       (default {@link StorageConstants#DEFAULT_TIMEOUT})</li>
 *   <li>{@code storage.retry.deadline.seconds} / {@code STORAGE_RETRY_DEADLINE_SECONDS}
 *       (default {@link #DEFAULT_RETRY_DEADLINE})</li>
 * </ul>
 */
public final class StorageSettings {

    public static final String REQUEST_TIMEOUT_PROPERTY = "storage.request.timeout.seconds";
    public static final String REQUEST_TIMEOUT_ENV = "STORAGE_REQUEST_TIMEOUT_SECONDS";
    public static final String RETRY_DEADLINE_PROPERTY = "storage.retry.deadline.seconds";
    public static final String RETRY_DEADLINE_ENV = "STORAGE_RETRY_DEADLINE_SECONDS";

    /** Total time the default retry spends on one call. */
    public static final Duration DEFAULT_RETRY_DEADLINE = Duration.ofSeconds(120);

    private StorageSettings() {
    }

    public static Duration requestTimeout() {
        return resolveSeconds(REQUEST_TIMEOUT_PROPERTY, REQUEST_TIMEOUT_ENV,
                StorageConstants.DEFAULT_TIMEOUT, System::getenv);
    }

    public static Duration retryDeadline() {
        return resolveSeconds(RETRY_DEADLINE_PROPERTY, RETRY_DEADLINE_ENV,
                DEFAULT_RETRY_DEADLINE, System::getenv);
    }

    /**
     * @throws IllegalStateException if a value is set but is not a positive whole number of seconds
     */
    static Duration resolveSeconds(String sysProp, String envVar, Duration defaultValue,
                                   UnaryOperator<String> environment) {
        String source = sysProp;
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            source = envVar;
            value = environment.apply(envVar);
        }
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        long seconds;
        try {
            seconds = Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Invalid configuration '" + source + "': expected whole seconds, was '" + value + "'", e);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(
                    "Invalid configuration '" + source + "': must be positive, was " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }
}
