package org.javai.converge;

import org.javai.converge.resource.ResourceLocator;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a resource did not reach the expected state.
 * Carries the {@link ErrorKind} and, where one is involved, the locator of the resource.
 */
public class ConvergenceException extends Exception {

    private final ErrorKind kind;
    private final ResourceLocator locator;

    public ConvergenceException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public ConvergenceException(ErrorKind kind, ResourceLocator locator, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.locator = locator;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * The resource this error concerns, if any.
     */
    public Optional<ResourceLocator> locator() {
        return Optional.ofNullable(locator);
    }
}
