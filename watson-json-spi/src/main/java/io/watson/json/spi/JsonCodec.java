package io.watson.json.spi;

import java.io.InputStream;

/**
 * Minimal JSON codec interface providing tree-model parsing.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Watson payloads carry dynamically typed output values, so decoding goes through the
 * {@link JsonNode} tree rather than bound POJOs.
 */
public interface JsonCodec {

    /**
     * Parses a JSON document from a stream. The stream is not closed.
     * @param input JSON input stream
     * @return the root node, never null
     * @throws JsonException if the input is empty or not valid JSON
     */
    JsonNode readTree(InputStream input) throws JsonException;

    /**
     * Parses a JSON document from a string.
     * @param json JSON text
     * @return the root node, never null
     * @throws JsonException if the input is empty or not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;
}
