package org.javai.converge.poll;

import org.javai.converge.ConvergenceException;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.ErrorKind;
import org.javai.converge.PollOutcome;
import org.javai.converge.ops.PollReporter;
import org.javai.converge.resource.ResourceLocator;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Invokes a probe at a fixed interval until it reports done, reports a fatal error,
 * or the bounding context is done.
 *
 * <p>The probe runs immediately. After each {@link PollOutcome.Retryable} outcome the poller
 * waits for the interval, or until the context is cancelled if that comes first, and then
 * runs the probe again. Every outcome is passed to the {@link PollReporter} before the loop
 * decides whether to continue.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Poller poller = Poller.builder()
 *     .reporter(new Log4jPollReporter())
 *     .build();
 *
 * try (PollContext ctx = PollContext.background().withTimeout(Duration.ofMinutes(2))) {
 *     poller.poll("WaitForBackup", ctx, Duration.ofSeconds(2), c ->
 *         backupFinished() ? PollOutcome.done() : PollOutcome.retry(ErrorKind.CONDITION_MISMATCH, "backup running"));
 * }
 * }</pre>
 */
public final class Poller {

    private static final String DEFAULT_OPERATION = "poll";

    private final PollReporter reporter;
    private final Sleeper sleeper;

    private Poller(PollReporter reporter, Sleeper sleeper) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates a poller that reports nothing.
     */
    public static Poller create() {
        return builder().build();
    }

    /**
     * Creates a builder for configuring a Poller instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Poller instance.
     */
    public static final class Builder {
        private PollReporter reporter = PollReporter.noOp();
        private Sleeper sleeper = PollContext::awaitDone;

        private Builder() {}

        /**
         * Sets the reporter for poll events (optional, defaults to no-op).
         *
         * @param reporter the reporter for poll events
         * @return this builder
         */
        public Builder reporter(PollReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Poller build() {
            return new Poller(reporter, sleeper);
        }
    }

    /**
     * Polls until the probe is done.
     *
     * @param context bounds the whole loop
     * @param interval the wait between attempts (must be positive)
     * @param probe the attempt to repeat
     * @throws ConvergenceException the fatal error reported by the probe, or a
     *         {@link DeadlineExceededException} carrying the last retryable reason
     */
    public void poll(PollContext context, Duration interval, PollProbe probe) throws ConvergenceException {
        poll(DEFAULT_OPERATION, null, context, interval, probe);
    }

    /**
     * Polls until the probe is done, naming the operation for reporting.
     */
    public void poll(String operation, PollContext context, Duration interval, PollProbe probe)
            throws ConvergenceException {
        poll(operation, null, context, interval, probe);
    }

    /**
     * Polls until the probe is done, naming the operation and the resource being polled.
     *
     * @param operation the operation name for reporting and error messages
     * @param subject the resource being polled (may be null)
     * @param context bounds the whole loop
     * @param interval the wait between attempts (must be positive)
     * @param probe the attempt to repeat
     * @throws ConvergenceException the fatal error reported by the probe, or a
     *         {@link DeadlineExceededException} carrying the last retryable reason
     */
    public void poll(String operation, ResourceLocator subject, PollContext context, Duration interval, PollProbe probe)
            throws ConvergenceException {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(probe, "probe must not be null");
        requirePositive(interval);

        Instant startedAt = context.clock().instant();
        PollOutcome.Retryable last = null;
        int attempt = 0;

        while (true) {
            attempt++;
            PollOutcome outcome = Objects.requireNonNull(probe.attempt(context), "probe must not return null");

            if (outcome instanceof PollOutcome.Done) {
                reporter.reportDone(operation, subject, attempt, elapsedSince(context, startedAt));
                return;
            }
            if (outcome instanceof PollOutcome.Fatal fatal) {
                reporter.reportFatal(operation, subject, attempt, fatal.error());
                throw fatal.error();
            }

            last = (PollOutcome.Retryable) outcome;
            reporter.reportRetry(new PollAttempt(operation, subject, attempt, last, elapsedSince(context, startedAt)));

            boolean done;
            try {
                done = sleeper.sleep(context, interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                DeadlineExceededException cancelled =
                        new DeadlineExceededException(ErrorKind.CANCELLED, operation, attempt, last, subject);
                cancelled.addSuppressed(e);
                reporter.reportDeadlineExceeded(operation, cancelled, elapsedSince(context, startedAt));
                throw cancelled;
            }

            if (done) {
                ErrorKind reason = context.doneReason().orElse(ErrorKind.DEADLINE_EXCEEDED);
                DeadlineExceededException exceeded =
                        new DeadlineExceededException(reason, operation, attempt, last, subject);
                reporter.reportDeadlineExceeded(operation, exceeded, elapsedSince(context, startedAt));
                throw exceeded;
            }
        }
    }

    /**
     * Polls under a fresh context that expires after {@code timeout}.
     */
    public void pollFor(String operation, Duration timeout, Duration interval, PollProbe probe)
            throws ConvergenceException {
        try (PollContext context = PollContext.background().withTimeout(timeout)) {
            poll(operation, null, context, interval, probe);
        }
    }

    private static Duration elapsedSince(PollContext context, Instant startedAt) {
        return Duration.between(startedAt, context.clock().instant());
    }

    private static void requirePositive(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, was: " + interval);
        }
    }

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        /**
         * @return true if the context is done on return
         */
        boolean sleep(PollContext context, Duration interval) throws InterruptedException;
    }
}
