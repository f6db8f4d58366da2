package io.watson.json.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one parsed JSON value.
 *
 * <p>Accessors never throw on a type mismatch; they return an empty result instead so callers can
 * report the actual {@link #type()}.
 */
public interface JsonNode {

    JsonNodeType type();

    default boolean isObject() {
        return type() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return type() == JsonNodeType.ARRAY;
    }

    default boolean isNull() {
        return type() == JsonNodeType.NULL;
    }

    /**
     * The member named {@code name}, empty if absent or if this is not an object. A member whose
     * value is JSON {@code null} is present with type {@link JsonNodeType#NULL}.
     */
    Optional<JsonNode> field(String name);

    /**
     * Object members in document order; empty for every other type.
     */
    Map<String, JsonNode> fields();

    /**
     * Array elements in document order; empty for every other type.
     */
    List<JsonNode> elements();

    /**
     * The string value of a {@link JsonNodeType#STRING} node.
     */
    Optional<String> textValue();

    /**
     * The value of a {@link JsonNodeType#BOOLEAN} node.
     */
    Optional<Boolean> booleanValue();

    /**
     * Compact JSON serialization of this node.
     */
    @Override
    String toString();
}
