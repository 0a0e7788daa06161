package org.javai.storage.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.storage.Failure;
import org.javai.storage.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Reports retry activity as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.objects.get","attemptNumber":1,"delayMs":1000,"code":"storage:rateLimitExceeded","operation":"objects.get"}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.storage.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;

	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prepended to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		ObjectNode event = baseEvent("retry_attempt", failure);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		ObjectNode event = baseEvent("retry_exhausted", failure);
		event.put("totalAttempts", totalAttempts);
		emit(event);
	}

	@Override
	public void reportGiveUp(Failure failure) {
		ObjectNode event = baseEvent("give_up", failure);
		event.put("type", failure.type().name());
		event.put("message", failure.message());
		emit(event);
	}

	private ObjectNode baseEvent(String eventType, Failure failure) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		event.put("trackingKey", buildTrackingKey(failure));
		event.put("code", failure.id().toString());
		event.put("operation", failure.operation());
		if (!failure.tags().isEmpty()) {
			ObjectNode tags = event.putObject("tags");
			for (Map.Entry<String, String> tag : failure.tags().entrySet()) {
				tags.put(tag.getKey(), tag.getValue());
			}
		}
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize metrics event {}", event.path("eventType").asText(), e);
		}
	}

	String buildTrackingKey(Failure failure) {
		if (namespace == null) {
			return failure.operation();
		}
		return namespace + "." + failure.operation();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
