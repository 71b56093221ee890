package org.javai.converge.resource;

import java.util.Objects;

/**
 * Identifies one remote resource by kind, namespace and name.
 *
 * @param kind the resource type
 * @param namespace the namespace holding the resource
 * @param name the resource name
 */
public record ResourceLocator(ResourceKind kind, String namespace, String name) {

    public ResourceLocator {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static ResourceLocator of(ResourceKind kind, String namespace, String name) {
        return new ResourceLocator(kind, namespace, name);
    }

    /**
     * Locates an {@code apps/v1 Deployment}.
     */
    public static ResourceLocator deployment(String namespace, String name) {
        return new ResourceLocator(ResourceKind.deployment(), namespace, name);
    }

    @Override
    public String toString() {
        return "(ns: %s, name: %s, kind %s)".formatted(namespace, name, kind.kind());
    }
}
