package org.javai.converge.scale;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * The replica count read from a target, next to the count the caller wants.
 *
 * @param currentReplicas the count read, empty if the target does not exist
 * @param desiredReplicas the count the caller wants
 */
public record ReplicaConvergenceState(OptionalInt currentReplicas, int desiredReplicas) {

    public ReplicaConvergenceState {
        Objects.requireNonNull(currentReplicas, "currentReplicas must not be null, use OptionalInt.empty()");
        if (desiredReplicas < 0) {
            throw new IllegalArgumentException("desiredReplicas must be >= 0, was: " + desiredReplicas);
        }
    }

    public boolean isAbsent() {
        return currentReplicas.isEmpty();
    }

    public boolean isConverged() {
        return currentReplicas.isPresent() && currentReplicas.getAsInt() == desiredReplicas;
    }
}
