package io.watson.client;

import io.watson.json.spi.JsonNodeType;

/**
 * An output whose value is not a string and therefore cannot be converted.
 *
 * @param name the output key
 * @param type the JSON type the service sent
 */
public record IgnoredOutput(String name, JsonNodeType type) {
}
