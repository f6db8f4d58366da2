package io.watson.client;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup of configuration keys such as {@code watson_ADDRESS}.
 *
 * <p>The resolver never reads the process environment directly; it goes through a source so
 * resolution stays a function of its inputs.
 */
@FunctionalInterface
public interface ConfigSource {

    /**
     * Returns the value configured for {@code key}, if any. Empty strings are returned as-is.
     */
    Optional<String> get(String key);

    /**
     * A source backed by {@link System#getenv(String)}.
     */
    static ConfigSource environment() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    /**
     * A source backed by a fixed map, typically used in tests.
     */
    static ConfigSource of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(Objects.requireNonNull(values, "values"));
        return key -> Optional.ofNullable(copy.get(key));
    }

    /**
     * A source with no keys.
     */
    static ConfigSource none() {
        return key -> Optional.empty();
    }
}
