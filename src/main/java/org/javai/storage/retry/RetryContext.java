package org.javai.storage.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What a retry policy knows about the attempts made so far.
 *
 * @param attemptNumber The attempt that just failed (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt
 * @param budget Total time allowed for all attempts (null if unlimited)
 */
public record RetryContext(
        int attemptNumber,
        Instant startedAt,
        Duration elapsed,
        Duration budget
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Instant now) {
        return new RetryContext(1, now, Duration.ZERO, null);
    }

    public static RetryContext first(Instant now, Duration budget) {
        return new RetryContext(1, now, Duration.ZERO, budget);
    }

    /**
     * The context for the following attempt, observed at {@code now}.
     */
    public RetryContext next(Instant now) {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, now), budget);
    }

    /**
     * This attempt re-timed at {@code now}, usually the moment it failed.
     */
    public RetryContext at(Instant now) {
        return new RetryContext(attemptNumber, startedAt, Duration.between(startedAt, now), budget);
    }

    public boolean hasBudgetRemaining() {
        return budget == null || budget.compareTo(elapsed) > 0;
    }

    /**
     * Whether an attempt started after waiting {@code delay} would still begin inside the budget.
     */
    public boolean allowsWaiting(Duration delay) {
        return budget == null || elapsed.plus(delay).compareTo(budget) < 0;
    }

    /**
     * Budget left, never negative. Null when the budget is unlimited.
     */
    public Duration remainingBudget() {
        if (budget == null) {
            return null;
        }
        Duration remaining = budget.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
