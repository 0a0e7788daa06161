package org.javai.storage.ops;

import org.javai.storage.Failure;

import java.time.Duration;

/**
 * Reports what the retry driver does with failed storage calls.
 * Implementations might emit metrics or structured logs.
 */
public interface RetryReporter {

	/**
	 * Reports that a failed attempt will be retried.
	 *
	 * @param failure The failure that triggered the retry
	 * @param attemptNumber The attempt that failed (1-based)
	 * @param delay How long the driver waits before the next attempt
	 */
	void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay);

	/**
	 * Reports that a retryable failure was given up on because attempts or time ran out.
	 *
	 * @param failure The final failure
	 * @param totalAttempts The total number of attempts made
	 */
	void reportRetryExhausted(Failure failure, int totalAttempts);

	/**
	 * Reports a failure that was not retried because it is not retryable.
	 */
	default void reportGiveUp(Failure failure) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static RetryReporter noOp() {
		return new RetryReporter() {
			@Override
			public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
			}

			@Override
			public void reportRetryExhausted(Failure failure, int totalAttempts) {
			}
		};
	}

	/**
	 * Creates a reporter that fans out to all given reporters.
	 */
	static RetryReporter composite(RetryReporter... reporters) {
		return CompositeRetryReporter.of(reporters);
	}
}
