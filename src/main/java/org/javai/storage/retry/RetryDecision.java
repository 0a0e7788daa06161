package org.javai.storage.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} wants done with a failed attempt: wait and try again, or stop.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Start another attempt once {@code delay} has passed.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative, was: " + delay);
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop retrying. The reason ends up in the {@link org.javai.storage.error.RetriesExhaustedException}
     * message when the failure was retryable.
     */
    record GiveUp(String reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }
    }
}
