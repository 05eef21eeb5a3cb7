package org.javai.callguard;

import java.util.Objects;

/**
 * The classified kind of a failure, written {@code namespace:name}.
 *
 * <p>Retry configuration lists kinds that must never be retried, so ids have to be stable
 * across releases: {@code http:404}, {@code network:timeout}, {@code io:access_denied}.</p>
 *
 * @param namespace The subsystem the failure comes from (e.g., "http", "network", "sql")
 * @param name The specific failure within that namespace (e.g., "timeout", "503")
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

    /**
     * The kind for a response with the given HTTP status, e.g. {@code http:429}.
     */
    public static FailureId http(int status) {
        return new FailureId("http", Integer.toString(status));
    }

    /**
     * Parses the {@code namespace:name} form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the text has no separator or an empty half
     */
    public static FailureId parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int separator = text.indexOf(':');
        if (separator <= 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("expected namespace:name, got: " + text);
        }
        return new FailureId(text.substring(0, separator).trim(), text.substring(separator + 1).trim());
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
