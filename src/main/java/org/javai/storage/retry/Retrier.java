package org.javai.storage.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.storage.Failure;
import org.javai.storage.ThrowingSupplier;
import org.javai.storage.error.RetriesExhaustedException;
import org.javai.storage.error.StorageException;
import org.javai.storage.error.TransportErrorTranslator;
import org.javai.storage.ops.RetryReporter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs storage requests, retrying failed attempts as its {@link RetryPolicy} allows.
 *
 * <p>Each {@link IOException} raised by an attempt is translated by
 * {@link TransportErrorTranslator}, classified, and handed to the policy. When the policy
 * gives up, a non-retryable error is rethrown as is, and a retryable one is wrapped in a
 * {@link RetriesExhaustedException}. Runtime exceptions are defects and are not caught.
 *
 * <p>Each failure is judged at the moment it happened, so time spent inside attempts counts
 * against the budget. No attempt starts at or after the end of the budget. A reporter that
 * throws is logged and ignored.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.exponentialBackoff("objects.get", 5, Duration.ofMillis(500), Duration.ofSeconds(10)))
 *     .budget(Duration.ofSeconds(60))
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * byte[] data = retrier.call("objects.get", () -> transport.download(bucket, name));
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Retrier {

    private static final Logger LOG = LogManager.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final FailureClassifier classifier;
    private final RetryReporter reporter;
    private final Duration budget;
    private final Sleeper sleeper;
    private final Clock clock;

    private Retrier(Builder builder) {
        this.policy = builder.policy;
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.budget = builder.budget;  // null means unlimited
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * The total time allowed for all attempts of one call, or null if unlimited.
     */
    public Duration budget() {
        return budget;
    }

    /**
     * Executes a request with retry according to the configured policy.
     *
     * @param operation The operation name for classification and reporting
     * @param work One attempt of the request
     * @return The result of the first successful attempt
     * @throws StorageException the last error, when the policy stops retrying
     */
    public <T> T call(String operation, ThrowingSupplier<T, ? extends IOException> work) throws StorageException {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        RetryContext context = RetryContext.first(clock.instant(), budget);
        while (true) {
            StorageException error;
            try {
                return work.get();
            } catch (IOException e) {
                error = TransportErrorTranslator.translate(e);
            }

            context = context.at(clock.instant());
            Failure failure = classifier.classify(operation, error);
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.Retry retry && !context.allowsWaiting(retry.delay())) {
                decision = RetryDecision.GiveUp.because("budget exhausted");
            }
            if (decision instanceof RetryDecision.GiveUp giveUp) {
                throw giveUp(operation, failure, error, context, giveUp);
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            int attemptNumber = context.attemptNumber();
            report("reportRetryAttempt", r -> r.reportRetryAttempt(failure, attemptNumber, delay));
            if (!sleep(delay)) {
                throw error;
            }
            context = context.next(clock.instant());
        }
    }

    private StorageException giveUp(String operation, Failure failure, StorageException error,
                                    RetryContext context, RetryDecision.GiveUp giveUp) {
        if (!failure.isTransient()) {
            report("reportGiveUp", r -> r.reportGiveUp(failure));
            return error;
        }
        report("reportRetryExhausted", r -> r.reportRetryExhausted(failure, context.attemptNumber()));
        return new RetriesExhaustedException(
                "Gave up on [" + operation + "] after " + context.attemptNumber()
                        + " attempt(s) with policy [" + policy.id() + "]: " + giveUp.reason(),
                context.attemptNumber(),
                error);
    }

    private void report(String method, Consumer<RetryReporter> call) {
        try {
            call.accept(reporter);
        } catch (RuntimeException e) {
            LOG.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
        }
    }

    // Returns false if interrupted; the interrupt flag is restored.
    private boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private FailureClassifier classifier = new StorageFailureClassifier();
        private RetryReporter reporter = RetryReporter.noOp();
        private Duration budget;
        private Sleeper sleeper = Thread::sleep;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the retry policy (required).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the failure classifier (optional, defaults to {@link StorageFailureClassifier}).
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the total time budget for one call (optional, defaults to unlimited).
         */
        public Builder budget(Duration budget) {
            Objects.requireNonNull(budget, "budget must not be null");
            if (budget.isNegative() || budget.isZero()) {
                throw new IllegalArgumentException("budget must be positive, was: " + budget);
            }
            this.budget = budget;
            return this;
        }

        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(this);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
