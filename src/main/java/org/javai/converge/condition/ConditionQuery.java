package org.javai.converge.condition;

import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ResourceKind;
import org.javai.converge.resource.ResourceLocator;

import java.util.Objects;

/**
 * One resource and the one condition to await on it.
 *
 * @param locator the resource to watch, including its kind
 * @param conditionType the expected condition type (e.g., "Ready")
 * @param expectedStatus the expected status (e.g., "True")
 * @param expectedReason the expected reason, matched exactly; empty matches only an empty reason
 */
public record ConditionQuery(
        ResourceLocator locator,
        String conditionType,
        String expectedStatus,
        String expectedReason
) {
    public ConditionQuery {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(conditionType, "conditionType must not be null");
        Objects.requireNonNull(expectedStatus, "expectedStatus must not be null");
        Objects.requireNonNull(expectedReason, "expectedReason must not be null");
    }

    public static ConditionQuery of(ResourceLocator locator, String conditionType, String expectedStatus,
                                    String expectedReason) {
        return new ConditionQuery(locator, conditionType, expectedStatus, expectedReason);
    }

    public ResourceKind resourceKind() {
        return locator.kind();
    }

    /**
     * Whether the given condition is the one this query awaits.
     */
    public boolean isSatisfiedBy(Condition condition) {
        return condition.matches(conditionType, expectedStatus, expectedReason);
    }

    /**
     * The expected triple, formatted for diagnostics.
     */
    public String expected() {
        return Condition.of(conditionType, expectedStatus, expectedReason).toString();
    }
}
