package io.watson.core;

import java.util.Optional;

/**
 * URI schemes the Watson service can be reached with.
 */
public enum Scheme {
    HTTP("http"),
    HTTPS("https");

    private final String value;

    Scheme(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Looks up a scheme by its exact lower-case name.
     *
     * @param value candidate scheme, may be null
     * @return the matching scheme, or empty when {@code value} is not exactly {@code http} or {@code https}
     */
    public static Optional<Scheme> of(String value) {
        if (value == null) return Optional.empty();
        for (Scheme s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #of(String)} but fails for unrecognized values.
     *
     * @throws WatsonException.InvalidScheme if {@code value} is not a recognized scheme
     */
    public static Scheme parse(String value) {
        return of(value).orElseThrow(() -> new WatsonException.InvalidScheme(value));
    }

    @Override
    public String toString() {
        return value;
    }
}
