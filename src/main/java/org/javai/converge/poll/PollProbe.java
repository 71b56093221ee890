package org.javai.converge.poll;

import org.javai.converge.PollOutcome;

/**
 * One look at the world, classified as done, retryable or fatal.
 *
 * <p>A probe may run many times, so it must be safe to repeat. It should take a fresh reading
 * on every call and never rely on what an earlier call observed.
 */
@FunctionalInterface
public interface PollProbe {

    /**
     * Performs one attempt.
     *
     * @param context the context bounding the whole poll; pass it to any remote call
     * @return the classified outcome, never null
     */
    PollOutcome attempt(PollContext context);
}
