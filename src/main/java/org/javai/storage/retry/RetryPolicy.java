package org.javai.storage.retry;

import org.javai.storage.Failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failure.
 *
 * <p>All factory policies give up at once on failures that are not
 * {@link org.javai.storage.FailureType#TRANSIENT}.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, Failure failure);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a simple policy with zero delay and max attempts.
     */
    static RetryPolicy immediate(String id, int maxAttempts) {
        return fixed(id, maxAttempts, Duration.ZERO);
    }

    /**
     * Creates a simple policy with fixed delay and max attempts.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        requireValidAttempts(maxAttempts);

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                RetryDecision.GiveUp giveUp = checkLimits(context, failure, maxAttempts);
                if (giveUp != null) {
                    return giveUp;
                }
                return retryWithin(context, atLeastRetryAfter(delay, failure));
            }
        };
    }

    /**
     * Creates a policy with exponential backoff: {@code initialDelay * 2^(attempt-1)}, capped at
     * {@code maxDelay}.
     */
    static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        requireValidAttempts(maxAttempts);

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                RetryDecision.GiveUp giveUp = checkLimits(context, failure, maxAttempts);
                if (giveUp != null) {
                    return giveUp;
                }
                Duration delay = backoff(initialDelay, maxDelay, 2.0, context.attemptNumber());
                return retryWithin(context, atLeastRetryAfter(delay, failure));
            }
        };
    }

    /**
     * Creates a policy that keeps retrying transient failures, with exponential backoff,
     * until the retry budget of the context is spent. It gives up once the next attempt
     * would start at or after the end of the budget. Without a budget it never gives up
     * on a transient failure.
     *
     * @param multiplier Growth factor between consecutive delays (must be >= 1)
     */
    static RetryPolicy untilDeadline(String id, Duration initialDelay, Duration maxDelay, double multiplier) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1, was: " + multiplier);
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                RetryDecision.GiveUp giveUp = checkLimits(context, failure, Integer.MAX_VALUE);
                if (giveUp != null) {
                    return giveUp;
                }
                Duration delay = backoff(initialDelay, maxDelay, multiplier, context.attemptNumber());
                return retryWithin(context, atLeastRetryAfter(delay, failure));
            }
        };
    }

    private static void requireValidAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    private static RetryDecision.GiveUp checkLimits(RetryContext context, Failure failure, int maxAttempts) {
        if (!failure.isTransient()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (context.attemptNumber() >= maxAttempts) {
            return RetryDecision.GiveUp.because("max attempts reached");
        }
        if (!context.hasBudgetRemaining()) {
            return RetryDecision.GiveUp.because("budget exhausted");
        }
        return null;
    }

    private static Duration backoff(Duration initialDelay, Duration maxDelay, double multiplier, int attemptNumber) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attemptNumber - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    private static RetryDecision retryWithin(RetryContext context, Duration delay) {
        if (!context.allowsWaiting(delay)) {
            return RetryDecision.GiveUp.because("budget exhausted");
        }
        return RetryDecision.Retry.after(delay);
    }

    // The server's Retry-After wins when it asks for more patience than the backoff
    private static Duration atLeastRetryAfter(Duration delay, Failure failure) {
        Duration hint = failure.retryAfter();
        return hint != null && hint.compareTo(delay) > 0 ? hint : delay;
    }
}
