package org.javai.gateway.failure;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a type of gateway failure, such as {@code network:timeout}
 * or {@code http:503}.
 *
 * @param namespace the subsystem (e.g., "network", "http", "breaker")
 * @param name the specific failure within that namespace
 */
public record FailureCode(String namespace, String name) {

    public FailureCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureCode of(String namespace, String name) {
        return new FailureCode(namespace, name);
    }

    public static FailureCode httpStatus(int status) {
        return new FailureCode("http", String.valueOf(status));
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
