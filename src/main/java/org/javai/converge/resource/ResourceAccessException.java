package org.javai.converge.resource;

import java.util.Objects;

/**
 * Thrown by resource collaborators when a read or write against the cluster fails.
 */
public class ResourceAccessException extends Exception {

    private final ResourceLocator locator;

    public ResourceAccessException(ResourceLocator locator, String message) {
        this(locator, message, null);
    }

    public ResourceAccessException(ResourceLocator locator, String message, Throwable cause) {
        super(message, cause);
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    public ResourceLocator locator() {
        return locator;
    }
}
