package org.javai.converge.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.converge.ConvergenceException;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.ErrorKind;
import org.javai.converge.ops.PollReporter;
import org.javai.converge.poll.PollAttempt;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.scale.ScaleState;

import java.time.Duration;

/**
 * Reports poll progress as human-readable Log4j2 lines.
 *
 * <p>Levels:
 * <ul>
 *   <li>retryable attempts, observed conditions, completions and scale steps → INFO</li>
 *   <li>deadline exceeded → WARN, cancellation → INFO</li>
 *   <li>fatal errors → ERROR</li>
 * </ul>
 */
public class Log4jPollReporter implements PollReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("POLL_RETRY");
	private static final Marker DONE_MARKER = MarkerManager.getMarker("POLL_DONE");
	private static final Marker FATAL_MARKER = MarkerManager.getMarker("POLL_FATAL");
	private static final Marker TIMEOUT_MARKER = MarkerManager.getMarker("POLL_TIMEOUT");
	private static final Marker CONDITION_MARKER = MarkerManager.getMarker("CONDITION");
	private static final Marker SCALE_MARKER = MarkerManager.getMarker("SCALE");

	private final Logger logger;

	/**
	 * Creates a Log4jPollReporter using the default logger name.
	 */
	public Log4jPollReporter() {
		this(LogManager.getLogger("org.javai.converge.PollReporter"));
	}

	/**
	 * Creates a Log4jPollReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jPollReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jPollReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jPollReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetry(PollAttempt attempt) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.withThrowable(attempt.outcome().cause())
			.log("Attempt {} of [{}]{} not done yet ({}): {}",
				attempt.attemptNumber(),
				attempt.operation(),
				formatSubject(attempt.subject()),
				attempt.outcome().kind(),
				attempt.outcome().reason());
	}

	@Override
	public void reportDone(String operation, ResourceLocator subject, int attempts, Duration elapsed) {
		logger.atInfo()
			.withMarker(DONE_MARKER)
			.log("[{}]{} done after {} attempt(s) in {} ms",
				operation,
				formatSubject(subject),
				attempts,
				elapsed.toMillis());
	}

	@Override
	public void reportFatal(String operation, ResourceLocator subject, int attempt, ConvergenceException error) {
		logger.atError()
			.withMarker(FATAL_MARKER)
			.withThrowable(error)
			.log("[{}]{} failed on attempt {} ({}): {}",
				operation,
				formatSubject(subject),
				attempt,
				error.kind(),
				error.getMessage());
	}

	@Override
	public void reportDeadlineExceeded(String operation, DeadlineExceededException error, Duration elapsed) {
		Level level = error.kind() == ErrorKind.CANCELLED ? Level.INFO : Level.WARN;
		logger.atLevel(level)
			.withMarker(TIMEOUT_MARKER)
			.log("[{}]{} gave up after {} attempt(s) in {} ms ({}). Last reason: {}",
				operation,
				formatSubject(error.locator().orElse(null)),
				error.attempts(),
				elapsed.toMillis(),
				error.kind(),
				error.lastReason().orElse("none"));
	}

	@Override
	public void reportConditionObserved(ResourceLocator locator, Condition condition) {
		logger.atInfo()
			.withMarker(CONDITION_MARKER)
			.log("{} {} has condition: ConditionType: {}, ConditionStatus: {}, ConditionReason: {}",
				locator.kind().kind(),
				locator,
				condition.type(),
				condition.status(),
				condition.reason());
	}

	@Override
	public void reportScaleTransition(ResourceLocator target, ScaleState from, ScaleState to) {
		logger.atInfo()
			.withMarker(SCALE_MARKER)
			.log("Scaling {} {}: {} -> {}", target.kind().kind(), target, from, to);
	}

	private static String formatSubject(ResourceLocator subject) {
		return subject != null ? " " + subject : "";
	}
}
