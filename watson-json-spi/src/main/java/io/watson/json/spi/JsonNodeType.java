package io.watson.json.spi;

import java.util.Locale;

/**
 * Enumeration of JSON node types.
 */
public enum JsonNodeType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    /**
     * Lower-case type tag used in diagnostics, e.g. {@code number}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
