package org.cloudplane.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cloudplane.api.ApiError;
import org.cloudplane.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object with an {@code eventType} of {@code retry_attempt},
 * {@code retry_exhausted}, {@code non_retryable} or {@code cancelled}, suitable for metrics
 * aggregation pipelines. The tracking key is the operation name, optionally prefixed with a
 * namespace.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"cloudplane.Topics.create","attemptNumber":1,"delayMs":1000,"code":"SERVICE_UNAVAILABLE","status":503}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.cloudplane.Metrics";
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
		Map<String, Object> event = event("retry_attempt", operation, failure);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts) {
		Map<String, Object> event = event("retry_exhausted", operation, failure);
		event.put("totalAttempts", totalAttempts);
		emit(event);
	}

	@Override
	public void reportNonRetryable(String operation, Throwable failure, int attemptNumber) {
		Map<String, Object> event = event("non_retryable", operation, failure);
		event.put("attemptNumber", attemptNumber);
		emit(event);
	}

	@Override
	public void reportCancelled(String operation, Throwable lastFailure, int attemptsMade) {
		Map<String, Object> event = event("cancelled", operation, lastFailure);
		event.put("attemptsMade", attemptsMade);
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private Map<String, Object> event(String eventType, String operation, Throwable failure) {
		Map<String, Object> event = new LinkedHashMap<>();
		event.put("eventType", eventType);
		event.put("timestamp", clock.instant().toString());
		event.put("trackingKey", buildTrackingKey(operation));
		if (failure instanceof ApiError apiError) {
			event.put("code", apiError.errorCode());
			event.put("status", apiError.statusCode());
		} else if (failure != null) {
			event.put("code", failure.getClass().getSimpleName());
		}
		return event;
	}

	private void emit(Map<String, Object> event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize retry event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
