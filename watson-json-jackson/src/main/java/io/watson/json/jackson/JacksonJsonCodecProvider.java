package io.watson.json.jackson;

import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    private static final JsonCodec CODEC = new JacksonJsonCodec();

    @Override
    public JsonCodec codec() {
        return CODEC;
    }
}
