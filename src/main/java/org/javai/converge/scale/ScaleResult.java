package org.javai.converge.scale;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The result of a successful scale-and-converge run.
 *
 * @param previousReplicas the count before the run, for restoring it later; empty if none was read
 * @param disposition how the run ended
 * @param path the states visited, in order
 */
public record ScaleResult(OptionalInt previousReplicas, ScaleDisposition disposition, List<ScaleState> path) {

    public ScaleResult {
        Objects.requireNonNull(previousReplicas, "previousReplicas must not be null, use OptionalInt.empty()");
        Objects.requireNonNull(disposition, "disposition must not be null");
        path = List.copyOf(path);
    }

    /**
     * Whether a write was issued.
     */
    public boolean mutated() {
        return disposition == ScaleDisposition.SCALED;
    }
}
