package io.watson.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Loads the first registered codec using the context class loader.
     *
     * @throws IllegalStateException if no {@link JsonCodecProvider} is registered
     */
    public static JsonCodec load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }

    /**
     * Loads the first registered codec visible to {@code cl}.
     *
     * @throws IllegalStateException if no {@link JsonCodecProvider} is registered
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) {
                return codec;
            }
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                + " found on the classpath; add watson-json-jackson or pass a JsonCodec explicitly");
    }
}
