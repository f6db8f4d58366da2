package io.watson.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/io.watson.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Returns a codec instance. Codecs must be thread-safe.
     */
    JsonCodec codec();
}
