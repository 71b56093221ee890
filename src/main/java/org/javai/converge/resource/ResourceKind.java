package org.javai.converge.resource;

import java.util.Objects;

/**
 * The group, version and kind of a cluster resource type.
 *
 * @param group API group, empty for the core group
 * @param version API version (e.g., "v1", "v1alpha1")
 * @param kind resource kind (e.g., "Deployment", "Infrastructure")
 */
public record ResourceKind(String group, String version, String kind) {

    public ResourceKind {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
        if (kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
    }

    public static ResourceKind of(String group, String version, String kind) {
        return new ResourceKind(group, version, kind);
    }

    /**
     * The {@code apps/v1 Deployment} kind.
     */
    public static ResourceKind deployment() {
        return new ResourceKind("apps", "v1", "Deployment");
    }

    @Override
    public String toString() {
        String groupVersion = group.isEmpty() ? version : group + "/" + version;
        return groupVersion + ", Kind=" + kind;
    }
}
