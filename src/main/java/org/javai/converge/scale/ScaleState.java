package org.javai.converge.scale;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a scale-and-converge run.
 *
 * <pre>
 * IDLE → READ → (SKIP | MUTATE) → VERIFY → DONE
 *              READ, MUTATE, VERIFY → FAILED
 * IDLE → SKIP when no desired count is given
 * </pre>
 */
public enum ScaleState {
    /** Nothing has happened yet. */
    IDLE,
    /** Reading the current replica count. */
    READ,
    /** No write is needed. */
    SKIP,
    /** Writing the desired replica count. */
    MUTATE,
    /** Polling until the reported count equals the desired count. */
    VERIFY,
    /** Finished successfully. */
    DONE,
    /** Finished with an error. */
    FAILED;

    /**
     * The states reachable from this one in a single step.
     */
    public Set<ScaleState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(READ, SKIP);
            case READ -> EnumSet.of(SKIP, MUTATE, FAILED);
            case SKIP -> EnumSet.of(DONE);
            case MUTATE -> EnumSet.of(VERIFY, FAILED);
            case VERIFY -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(ScaleState.class);
        };
    }

    public boolean canTransitionTo(ScaleState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
