package org.javai.restretry;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of failure.
 *
 * @param namespace The subsystem (e.g., "network", "http", "retry")
 * @param name The specific failure within that namespace (e.g., "timeout", "connection_refused")
 */
public record FailureId(String namespace, String name) {

    public FailureId {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureId of(String namespace, String name) {
        return new FailureId(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
