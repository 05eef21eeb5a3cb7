package org.javai.callguard.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.callguard.Failure;
import org.javai.callguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Reports call activity as JSON-lines metrics events via SLF4J.
 *
 * <p>One JSON object per event, keyed by a tracking key made of an optional namespace and the
 * operation key, suitable for a log-based metrics pipeline.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.user:1","attemptNumber":1,"delayMs":100,"kind":"http:503"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.callguard.Metrics";
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode event = event("failure", failure.occurredAt(), failure.operation());
		event.put("kind", failure.id().toString());
		event.put("type", failure.type().name());
		event.put("attemptNumber", failure.attempt());
		event.put("message", failure.message());
		if (!failure.tags().isEmpty()) {
			ObjectNode tags = event.putObject("tags");
			failure.tags().forEach(tags::put);
		}
		emit(event);
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		ObjectNode event = event("retry_attempt", failure.occurredAt(), failure.operation());
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("kind", failure.id().toString());
		emit(event);
	}

	@Override
	public void reportGaveUp(Failure failure, int totalAttempts, String reason) {
		ObjectNode event = event("gave_up", failure.occurredAt(), failure.operation());
		event.put("totalAttempts", totalAttempts);
		event.put("reason", reason);
		event.put("kind", failure.id().toString());
		emit(event);
	}

	@Override
	public void reportRefreshFailure(String key, Throwable error) {
		ObjectNode event = event("refresh_failed", Instant.now(), key);
		event.put("error", error.getClass().getName());
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String eventType, Instant timestamp, String operation) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", timestamp.toString());
		event.put("trackingKey", buildTrackingKey(operation));
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.debug("Dropped metrics event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
