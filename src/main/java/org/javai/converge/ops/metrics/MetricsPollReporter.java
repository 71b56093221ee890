package org.javai.converge.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.converge.ConvergenceException;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.ops.PollReporter;
import org.javai.converge.poll.PollAttempt;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.scale.ScaleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.InstantSource;
import java.time.format.DateTimeFormatter;

/**
 * Reports poll events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation pipelines.
 * The tracking key is the operation name, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"poll_retry","timestamp":"2024-01-20T10:30:00Z","trackingKey":"provisioning.WaitForCondition","attemptNumber":3,...}
 * }</pre>
 *
 * <p>Observed conditions are not emitted; they are diagnostic detail rather than metrics.</p>
 */
public class MetricsPollReporter implements PollReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.converge.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final InstantSource clock;
	private final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Creates a MetricsPollReporter with no namespace and the default logger.
	 */
	public MetricsPollReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), InstantSource.system());
	}

	/**
	 * Creates a MetricsPollReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsPollReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), InstantSource.system());
	}

	/**
	 * Creates a MetricsPollReporter with the specified namespace and custom logger name.
	 */
	public MetricsPollReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), InstantSource.system());
	}

	/**
	 * Creates a MetricsPollReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsPollReporter(String namespace, Logger logger, InstantSource clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetry(PollAttempt attempt) {
		emit(buildRetryJson(attempt));
	}

	@Override
	public void reportDone(String operation, ResourceLocator subject, int attempts, Duration elapsed) {
		emit(buildDoneJson(operation, subject, attempts, elapsed));
	}

	@Override
	public void reportFatal(String operation, ResourceLocator subject, int attempt, ConvergenceException error) {
		emit(buildFatalJson(operation, subject, attempt, error));
	}

	@Override
	public void reportDeadlineExceeded(String operation, DeadlineExceededException error, Duration elapsed) {
		emit(buildDeadlineJson(operation, error, elapsed));
	}

	@Override
	public void reportScaleTransition(ResourceLocator target, ScaleState from, ScaleState to) {
		ObjectNode node = event("scale_transition", "ScaleAndConverge", target);
		node.put("from", from.name());
		node.put("to", to.name());
		emit(node);
	}

	ObjectNode buildRetryJson(PollAttempt attempt) {
		ObjectNode node = event("poll_retry", attempt.operation(), attempt.subject());
		node.put("attemptNumber", attempt.attemptNumber());
		node.put("elapsedMs", attempt.elapsed().toMillis());
		node.put("kind", attempt.outcome().kind().name());
		node.put("reason", attempt.outcome().reason());
		return node;
	}

	ObjectNode buildDoneJson(String operation, ResourceLocator subject, int attempts, Duration elapsed) {
		ObjectNode node = event("poll_done", operation, subject);
		node.put("totalAttempts", attempts);
		node.put("elapsedMs", elapsed.toMillis());
		return node;
	}

	ObjectNode buildFatalJson(String operation, ResourceLocator subject, int attempt, ConvergenceException error) {
		ObjectNode node = event("poll_fatal", operation, subject);
		node.put("attemptNumber", attempt);
		node.put("kind", error.kind().name());
		node.put("message", error.getMessage());
		return node;
	}

	ObjectNode buildDeadlineJson(String operation, DeadlineExceededException error, Duration elapsed) {
		ObjectNode node = event("poll_deadline_exceeded", operation, error.locator().orElse(null));
		node.put("totalAttempts", error.attempts());
		node.put("elapsedMs", elapsed.toMillis());
		node.put("kind", error.kind().name());
		error.lastRetryableKind().ifPresent(kind -> node.put("lastKind", kind.name()));
		error.lastReason().ifPresent(reason -> node.put("lastReason", reason));
		return node;
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String eventType, String operation, ResourceLocator subject) {
		ObjectNode node = mapper.createObjectNode();
		node.put("eventType", eventType);
		node.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		node.put("trackingKey", buildTrackingKey(operation));
		node.put("operation", operation);
		if (subject != null) {
			ObjectNode resource = node.putObject("resource");
			resource.put("kind", subject.kind().kind());
			resource.put("namespace", subject.namespace());
			resource.put("name", subject.name());
		}
		return node;
	}

	private void emit(ObjectNode node) {
		try {
			logger.info(mapper.writeValueAsString(node));
		} catch (JsonProcessingException e) {
			logger.warn("Unable to encode poll event {}", node.path("eventType").asText(), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
