package io.watson.client;

import io.watson.json.spi.JsonNodeType;

import java.util.Objects;
import java.util.Optional;

/**
 * The dynamically typed value of an {@link Output}.
 *
 * <p>Only {@link Text} values convert to a string for downstream use. Every other JSON type is kept
 * as {@link Other} with its raw serialization so callers can report it as ignored.
 */
public sealed interface OutputValue permits OutputValue.Text, OutputValue.Other {

    /**
     * The JSON type the service sent.
     */
    JsonNodeType type();

    /**
     * The string value, or empty for non-string values.
     */
    Optional<String> asString();

    static OutputValue text(String value) {
        return new Text(value);
    }

    static OutputValue other(JsonNodeType type, String raw) {
        return new Other(type, raw);
    }

    /**
     * A JSON string value.
     *
     * @param value the string, never null
     */
    record Text(String value) implements OutputValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public JsonNodeType type() {
            return JsonNodeType.STRING;
        }

        @Override
        public Optional<String> asString() {
            return Optional.of(value);
        }
    }

    /**
     * Any non-string JSON value (number, boolean, object, array or null).
     *
     * @param type the observed JSON type, never {@link JsonNodeType#STRING}
     * @param raw compact JSON serialization of the value
     */
    record Other(JsonNodeType type, String raw) implements OutputValue {
        public Other {
            Objects.requireNonNull(type, "type");
            if (type == JsonNodeType.STRING) {
                throw new IllegalArgumentException("string values must use OutputValue.Text");
            }
            raw = raw == null ? "null" : raw;
        }

        @Override
        public Optional<String> asString() {
            return Optional.empty();
        }
    }
}
