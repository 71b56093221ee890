package org.javai.converge.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * One status condition reported by a managed resource.
 *
 * @param type the aspect of readiness this condition describes (e.g., "Ready")
 * @param status one of "True", "False", "Unknown"
 * @param reason machine-readable reason for the last transition, empty if none was given
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(String type, String status, String reason) {

    public Condition {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
        reason = reason == null ? "" : reason;
    }

    public static Condition of(String type, String status, String reason) {
        return new Condition(type, status, reason);
    }

    /**
     * Whether type, status and reason all equal the given values exactly.
     */
    public boolean matches(String expectedType, String expectedStatus, String expectedReason) {
        return type.equals(expectedType) && status.equals(expectedStatus) && reason.equals(expectedReason);
    }

    @Override
    public String toString() {
        return "(conditionType: %s, conditionStatus: %s, conditionReason: %s)".formatted(type, status, reason);
    }
}
