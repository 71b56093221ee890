package org.javai.converge.poll;

import org.javai.converge.PollOutcome;
import org.javai.converge.resource.ResourceLocator;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A retryable poll attempt, as passed to reporters.
 *
 * @param operation the operation being polled for
 * @param subject the resource being polled, may be null
 * @param attemptNumber the attempt number (1-based)
 * @param outcome why the attempt did not succeed
 * @param elapsed time since the first attempt started
 */
public record PollAttempt(
        String operation,
        ResourceLocator subject,
        int attemptNumber,
        PollOutcome.Retryable outcome,
        Duration elapsed
) {
    public PollAttempt {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
    }

    public Optional<ResourceLocator> subjectLocator() {
        return Optional.ofNullable(subject);
    }
}
