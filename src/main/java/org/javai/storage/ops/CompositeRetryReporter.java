package org.javai.storage.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.storage.Failure;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. A reporter that throws is logged and
 * skipped, so the remaining reporters still run and the storage error is never masked.
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOG = LogManager.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		forEach("reportRetryAttempt", r -> r.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		forEach("reportRetryExhausted", r -> r.reportRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void reportGiveUp(Failure failure) {
		forEach("reportGiveUp", r -> r.reportGiveUp(failure));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<RetryReporter> call) {
		for (RetryReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOG.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
