package org.javai.converge.scale;

/**
 * How a successful scale-and-converge run ended.
 */
public enum ScaleDisposition {
    /** The caller gave no desired count; nothing was read or written. */
    NO_DESIRED_REPLICAS,
    /** The target does not exist or reports no replica count; nothing was written. */
    TARGET_ABSENT,
    /** The target already had the desired count; nothing was written. */
    ALREADY_CONVERGED,
    /** The desired count was written and observed. */
    SCALED
}
