package org.javai.converge.ops;

import org.javai.converge.ConvergenceException;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.poll.PollAttempt;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.scale.ScaleState;

import java.time.Duration;

/**
 * Receives the status of each poll attempt for observability.
 * Implementations might write log lines, emit metrics, or collect events in tests.
 * No polling behaviour depends on a reporter.
 */
public interface PollReporter {

    /**
     * Reports a retryable attempt. The poll loop will wait and try again.
     */
    void reportRetry(PollAttempt attempt);

    /**
     * Reports that the probe signalled completion.
     *
     * @param operation the operation that completed
     * @param subject the resource polled (may be null)
     * @param attempts the total number of attempts made
     * @param elapsed time since the first attempt started
     */
    default void reportDone(String operation, ResourceLocator subject, int attempts, Duration elapsed) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the probe signalled an unrecoverable error.
     */
    default void reportFatal(String operation, ResourceLocator subject, int attempt, ConvergenceException error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the poll loop gave up because its context expired or was cancelled.
     */
    default void reportDeadlineExceeded(String operation, DeadlineExceededException error, Duration elapsed) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports one condition observed on a resource while scanning for an expected condition.
     */
    default void reportConditionObserved(ResourceLocator locator, Condition condition) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a step of the scale-and-converge state machine.
     */
    default void reportScaleTransition(ResourceLocator target, ScaleState from, ScaleState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static PollReporter noOp() {
        return attempt -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static PollReporter composite(PollReporter... reporters) {
        return CompositePollReporter.of(reporters);
    }
}
