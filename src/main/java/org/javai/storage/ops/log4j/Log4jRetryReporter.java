package org.javai.storage.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.storage.Failure;
import org.javai.storage.FailureType;
import org.javai.storage.ops.RetryReporter;

import java.time.Duration;
import java.util.Map;

/**
 * Reports retry activity using Log4j2.
 *
 * <ul>
 *   <li>retry attempts → INFO, marker {@code RETRY}</li>
 *   <li>exhausted retries → WARN, marker {@code RETRY_EXHAUSTED}</li>
 *   <li>non-retryable failures → by failure type, marker {@code FAILURE}</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.storage.Retry"));
	}

	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying [{}] after attempt {} in {} ms. Code: {}, Message: {}",
				failure.operation(),
				attemptNumber,
				delay.toMillis(),
				failure.id(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for [{}] after {} attempts. Code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.id(),
				failure.message());
	}

	@Override
	public void reportGiveUp(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	private static String formatFailureMessage(Failure failure) {
		return "Failure in operation [%s]: %s | code=%s, type=%s%s".formatted(
			failure.operation(),
			failure.message(),
			failure.id(),
			failure.type(),
			formatTags(failure.tags()));
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case DEFECT -> Level.ERROR;
			case PERMANENT -> Level.WARN;
			case TRANSIENT -> Level.INFO;
		};
	}
}
