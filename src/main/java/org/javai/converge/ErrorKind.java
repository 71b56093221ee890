package org.javai.converge;

/**
 * Classifies what went wrong while waiting for a resource to converge.
 */
public enum ErrorKind {
    /**
     * The resource could not be read. It may not exist yet, or the read channel
     * may be briefly unavailable.
     */
    READ_FAILURE(true),

    /**
     * The resource was read but its status block could not be decoded.
     * Usually a race with a writer updating the resource.
     */
    DECODE_FAILURE(true),

    /**
     * The resource was read and decoded, but the expected condition is not present yet.
     */
    CONDITION_MISMATCH(true),

    /**
     * The reported replica count does not equal the desired count yet.
     */
    REPLICA_MISMATCH(true),

    /**
     * A mutation was rejected. Not retried.
     */
    WRITE_FAILURE(false),

    /**
     * The deadline passed before the probe reported completion.
     */
    DEADLINE_EXCEEDED(false),

    /**
     * The wait was cancelled by the caller or by an interrupt.
     */
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a poll loop absorbs this kind and tries again.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
