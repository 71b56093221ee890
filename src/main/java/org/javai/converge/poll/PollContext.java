package org.javai.converge.poll;

import org.javai.converge.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A cancellable deadline that bounds a wait.
 *
 * <p>Contexts form a tree. A child's deadline is never later than its parent's, and cancelling
 * a parent cancels every child. Expiry is evaluated against the {@link InstantSource} on demand,
 * so no timer thread is involved. Cancellation wakes any thread blocked in
 * {@link #awaitDone(Duration)} immediately.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (PollContext ctx = PollContext.background().withTimeout(Duration.ofMinutes(5))) {
 *     watcher.waitForCondition(ctx, query);
 * }
 * }</pre>
 *
 * <p>Instances are thread-safe; {@link #cancel()} may be called from any thread.
 */
public final class PollContext implements AutoCloseable {

    // Keeps the wait within the range of Duration.toNanos().
    private static final Duration MAX_WAIT = Duration.ofDays(365);

    private final PollContext parent;
    private final Instant deadline;
    private final InstantSource clock;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<ErrorKind> doneReason = new AtomicReference<>();
    private final List<PollContext> children = new CopyOnWriteArrayList<>();

    private PollContext(PollContext parent, Instant deadline, InstantSource clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A root context that never expires. It is done only once cancelled.
     */
    public static PollContext background() {
        return background(InstantSource.system());
    }

    /**
     * A root context that never expires, reading time from the given source.
     */
    public static PollContext background(InstantSource clock) {
        return new PollContext(null, null, Objects.requireNonNull(clock, "clock must not be null"));
    }

    /**
     * Derives a child that expires after the given timeout, or with this context if that is sooner.
     *
     * @param timeout time from now until the child expires (must not be negative)
     * @return the child context
     */
    public PollContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, was: " + timeout);
        }
        return withDeadline(clock.instant().plus(timeout));
    }

    /**
     * Derives a child that expires at the given instant, or with this context if that is sooner.
     */
    public PollContext withDeadline(Instant childDeadline) {
        Objects.requireNonNull(childDeadline, "deadline must not be null");
        Instant effective = deadline != null && deadline.isBefore(childDeadline) ? deadline : childDeadline;
        PollContext child = new PollContext(this, effective, clock);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Cancels this context and all contexts derived from it. Idempotent.
     */
    public void cancel() {
        doneReason.compareAndSet(null, isExpired() ? ErrorKind.DEADLINE_EXCEEDED : ErrorKind.CANCELLED);
        if (cancelled.getCount() > 0) {
            cancelled.countDown();
            for (PollContext child : children) {
                child.cancel();
            }
        }
    }

    /**
     * Cancels this context and detaches it from its parent.
     */
    @Override
    public void close() {
        cancel();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    /**
     * Whether the context was cancelled or its deadline has passed.
     */
    public boolean isDone() {
        if (doneReason.get() != null) {
            return true;
        }
        if (isExpired()) {
            doneReason.compareAndSet(null, ErrorKind.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /**
     * Why the context is done: {@link ErrorKind#DEADLINE_EXCEEDED} or {@link ErrorKind#CANCELLED}.
     * Empty while the context is still live.
     */
    public Optional<ErrorKind> doneReason() {
        isDone();
        return Optional.ofNullable(doneReason.get());
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative. Empty if the context has no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Blocks until this context is done or {@code max} has elapsed, whichever comes first.
     * A single call blocks for at most a year; callers that need longer call it again.
     *
     * @param max the longest time to block
     * @return true if the context is done on return
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean awaitDone(Duration max) throws InterruptedException {
        Objects.requireNonNull(max, "max must not be null");
        if (isDone()) {
            return true;
        }
        Duration wait = max.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : max;
        Optional<Duration> left = remaining();
        if (left.isPresent() && left.get().compareTo(wait) < 0) {
            wait = left.get();
        }
        if (!wait.isZero() && !wait.isNegative()) {
            cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
        }
        return isDone();
    }

    InstantSource clock() {
        return clock;
    }

    private boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    private boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
