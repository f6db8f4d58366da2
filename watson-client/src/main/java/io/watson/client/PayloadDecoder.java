package io.watson.client;

import io.watson.core.WatsonException;
import io.watson.json.spi.JsonNode;
import io.watson.json.spi.JsonNodeType;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns parsed Watson payloads into client models.
 *
 * <p>Shape violations raise {@link WatsonException.DecodeError}. A non-string output value is not a
 * shape violation; it is kept as {@link OutputValue.Other}.
 */
final class PayloadDecoder {
    static final String F_VALUE = "value";
    static final String F_DEPRECATED = "deprecated";
    static final String F_WARNING = "warning";
    static final String F_SENSITIVE = "sensitive";
    static final String F_ID = "id";
    static final String F_NAME = "name";
    static final String F_URL = "url";
    static final String F_USED_BY = "used_by";
    static final String F_LAST_USED_AT = "last_used_at";

    private PayloadDecoder() {}

    static Outputs decodeOutputs(JsonNode root) {
        requireObject(root, "outputs");
        Map<String, Output> entries = new LinkedHashMap<>();
        root.fields().forEach((name, node) -> entries.put(name, decodeOutput(name, node)));
        return new Outputs(entries);
    }

    static Output decodeOutput(String name, JsonNode node) {
        String context = "output \"" + name + "\"";
        requireObject(node, context);
        return new Output(
                decodeValue(node.field(F_VALUE)),
                optionalString(node, F_DEPRECATED, context),
                optionalString(node, F_WARNING, context),
                optionalBoolean(node, F_SENSITIVE, context));
    }

    static Stack decodeStack(JsonNode root) {
        requireObject(root, "stack");
        return new Stack(
                optionalString(root, F_ID, "stack"),
                optionalString(root, F_NAME, "stack"),
                optionalString(root, F_URL, "stack"),
                decodeUsedBy(root));
    }

    private static List<Stack.Dependent> decodeUsedBy(JsonNode stack) {
        Optional<JsonNode> field = present(stack, F_USED_BY);
        if (field.isEmpty()) {
            return List.of();
        }
        JsonNode node = field.get();
        if (!node.isArray()) {
            throw new WatsonException.DecodeError("stack field \"used_by\" must be an array but got " + node.type().tag());
        }
        List<JsonNode> elements = node.elements();
        List<Stack.Dependent> out = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            JsonNode entry = elements.get(i);
            String context = "used_by[" + i + "]";
            requireObject(entry, context);
            out.add(new Stack.Dependent(
                    optionalString(entry, F_ID, context),
                    optionalString(entry, F_URL, context),
                    optionalTimestamp(entry, F_LAST_USED_AT, context)));
        }
        return out;
    }

    // a missing value is reported like an explicit null
    private static OutputValue decodeValue(Optional<JsonNode> field) {
        if (field.isEmpty()) {
            return OutputValue.other(JsonNodeType.NULL, "null");
        }
        JsonNode node = field.get();
        return node.textValue()
                .map(OutputValue::text)
                .orElseGet(() -> OutputValue.other(node.type(), node.toString()));
    }

    private static void requireObject(JsonNode node, String context) {
        if (!node.isObject()) {
            throw new WatsonException.DecodeError(context + " must be a JSON object but got " + node.type().tag());
        }
    }

    private static Optional<JsonNode> present(JsonNode parent, String field) {
        return parent.field(field).filter(n -> !n.isNull());
    }

    // absent and null both decode to the empty string
    private static String optionalString(JsonNode parent, String field, String context) {
        return present(parent, field)
                .map(node -> node.textValue().orElseThrow(() -> mistyped(context, field, "a string", node)))
                .orElse("");
    }

    private static boolean optionalBoolean(JsonNode parent, String field, String context) {
        return present(parent, field)
                .map(node -> node.booleanValue().orElseThrow(() -> mistyped(context, field, "a boolean", node)))
                .orElse(false);
    }

    private static OffsetDateTime optionalTimestamp(JsonNode parent, String field, String context) {
        String text = optionalString(parent, field, context);
        if (text.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new WatsonException.DecodeError(context + " field \"" + field + "\" is not an RFC 3339 timestamp: " + text, e);
        }
    }

    private static WatsonException.DecodeError mistyped(String context, String field, String expected, JsonNode node) {
        return new WatsonException.DecodeError(
                context + " field \"" + field + "\" must be " + expected + " but got " + node.type().tag());
    }
}
