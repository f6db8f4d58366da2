package io.watson.json.jackson;

import io.watson.json.spi.JsonNode;
import io.watson.json.spi.JsonNodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link JsonNode} view over a Jackson tree. Children are wrapped lazily on access.
 */
final class JacksonJsonNode implements JsonNode {
    private final com.fasterxml.jackson.databind.JsonNode delegate;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public JsonNodeType type() {
        return switch (delegate.getNodeType()) {
            case OBJECT -> JsonNodeType.OBJECT;
            case ARRAY -> JsonNodeType.ARRAY;
            case STRING -> JsonNodeType.STRING;
            case NUMBER -> JsonNodeType.NUMBER;
            case BOOLEAN -> JsonNodeType.BOOLEAN;
            // BINARY and POJO only appear in trees built in memory, never in parsed input
            case NULL, MISSING, BINARY, POJO -> JsonNodeType.NULL;
        };
    }

    @Override
    public Optional<JsonNode> field(String name) {
        if (!delegate.isObject()) {
            return Optional.empty();
        }
        return Optional.ofNullable(delegate.get(name)).map(JacksonJsonNode::new);
    }

    @Override
    public Map<String, JsonNode> fields() {
        if (!delegate.isObject()) {
            return Map.of();
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        delegate.fields().forEachRemaining(e -> out.put(e.getKey(), new JacksonJsonNode(e.getValue())));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public List<JsonNode> elements() {
        if (!delegate.isArray()) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(delegate.size());
        delegate.elements().forEachRemaining(n -> out.add(new JacksonJsonNode(n)));
        return Collections.unmodifiableList(out);
    }

    @Override
    public Optional<String> textValue() {
        return delegate.isTextual() ? Optional.of(delegate.textValue()) : Optional.empty();
    }

    @Override
    public Optional<Boolean> booleanValue() {
        return delegate.isBoolean() ? Optional.of(delegate.booleanValue()) : Optional.empty();
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }
}
