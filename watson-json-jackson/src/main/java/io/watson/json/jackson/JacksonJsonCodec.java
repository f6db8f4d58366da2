package io.watson.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonException;
import io.watson.json.spi.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectReader}.
 *
 * <p>Trailing content after the root value is rejected. Floating point numbers are read as
 * {@link java.math.BigDecimal} so non-string outputs are not rounded through {@code double}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectReader reader;

    public JacksonJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Uses the given mapper's configuration for tree reading.
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.reader = Objects.requireNonNull(mapper, "mapper").reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public JsonNode readTree(InputStream input) throws JsonException {
        Objects.requireNonNull(input, "input");
        try {
            return wrap(reader.readTree(input));
        } catch (IOException e) {
            throw new JsonException("Malformed JSON: " + describe(e), e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        Objects.requireNonNull(json, "json");
        try {
            return wrap(reader.readTree(json));
        } catch (IOException e) {
            throw new JsonException("Malformed JSON: " + describe(e), e);
        }
    }

    private static String describe(IOException e) {
        return e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : String.valueOf(e.getMessage());
    }

    // empty content comes back as null or MissingNode depending on the entry point
    private static JsonNode wrap(com.fasterxml.jackson.databind.JsonNode node) throws JsonException {
        if (node == null || node.isMissingNode()) {
            throw new JsonException("No JSON content");
        }
        return new JacksonJsonNode(node);
    }
}
