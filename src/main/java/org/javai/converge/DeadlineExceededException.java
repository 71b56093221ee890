package org.javai.converge;

import org.javai.converge.resource.ResourceLocator;

import java.util.Optional;

/**
 * Thrown when a poll loop ends because its context expired or was cancelled.
 *
 * <p>The message and {@link #lastReason()} carry the reason given by the last retryable
 * attempt, so the caller sees why convergence never happened and not only that it didn't.
 */
public class DeadlineExceededException extends ConvergenceException {

    private final int attempts;
    private final String lastReason;
    private final ErrorKind lastRetryableKind;

    public DeadlineExceededException(ErrorKind kind, String operation, int attempts,
                                     PollOutcome.Retryable last, ResourceLocator locator) {
        super(kind, locator, formatMessage(kind, operation, attempts, last),
                last == null ? null : last.cause());
        if (kind != ErrorKind.DEADLINE_EXCEEDED && kind != ErrorKind.CANCELLED) {
            throw new IllegalArgumentException("kind must be DEADLINE_EXCEEDED or CANCELLED, was: " + kind);
        }
        this.attempts = attempts;
        this.lastReason = last == null ? null : last.reason();
        this.lastRetryableKind = last == null ? null : last.kind();
    }

    public int attempts() {
        return attempts;
    }

    /**
     * The reason reported by the last retryable attempt, if any attempt was retryable.
     */
    public Optional<String> lastReason() {
        return Optional.ofNullable(lastReason);
    }

    public Optional<ErrorKind> lastRetryableKind() {
        return Optional.ofNullable(lastRetryableKind);
    }

    private static String formatMessage(ErrorKind kind, String operation, int attempts, PollOutcome.Retryable last) {
        String verb = kind == ErrorKind.CANCELLED ? "was cancelled" : "did not complete before the deadline";
        String base = "%s %s after %d attempt%s".formatted(operation, verb, attempts, attempts == 1 ? "" : "s");
        return last == null ? base : base + ": " + last.reason();
    }
}
