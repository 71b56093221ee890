package org.javai.converge;

import java.util.Objects;

/**
 * The result of a single poll attempt.
 * Either {@link Done}, {@link Retryable} with the reason the attempt did not succeed,
 * or {@link Fatal} with an error that ends the loop.
 *
 * <p>{@code Retryable} never terminates a poll loop. {@code Fatal} always does.
 */
public sealed interface PollOutcome permits PollOutcome.Done, PollOutcome.Retryable, PollOutcome.Fatal {

    /**
     * The awaited state was observed.
     */
    record Done() implements PollOutcome {

        private static final Done INSTANCE = new Done();

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * The awaited state was not observed yet. The loop tries again after its interval.
     *
     * @param kind the retryable kind of failure
     * @param reason human-readable description, surfaced if the deadline passes
     * @param cause underlying exception (may be null)
     */
    record Retryable(ErrorKind kind, String reason, Throwable cause) implements PollOutcome {

        public Retryable {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
            if (!kind.isRetryable()) {
                throw new IllegalArgumentException(kind + " is not a retryable kind");
            }
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    /**
     * An unrecoverable state. The loop stops and throws {@link #error()}.
     *
     * @param error the error to surface to the caller
     */
    record Fatal(ConvergenceException error) implements PollOutcome {

        public Fatal {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * Whether this outcome stops the poll loop.
     */
    boolean isTerminal();

    // Static factories
    static PollOutcome done() {
        return Done.INSTANCE;
    }

    static PollOutcome retry(ErrorKind kind, String reason) {
        return new Retryable(kind, reason, null);
    }

    static PollOutcome retry(ErrorKind kind, String reason, Throwable cause) {
        return new Retryable(kind, reason, cause);
    }

    static PollOutcome fatal(ConvergenceException error) {
        return new Fatal(error);
    }
}
