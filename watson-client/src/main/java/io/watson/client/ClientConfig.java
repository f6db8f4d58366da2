package io.watson.client;

/**
 * Connection settings as supplied by the caller. Any field may be null or empty, in which case
 * the {@link ConfigResolver} falls back to the {@link ConfigSource} and then to the defaults.
 *
 * @param address the service address, optionally prefixed with {@code http://} or {@code https://}
 * @param scheme {@code http} or {@code https}
 * @param stack the calling stack, sent as {@code x-watson-stack} on every request
 */
public record ClientConfig(String address, String scheme, String stack) {

    private static final ClientConfig EMPTY = new ClientConfig(null, null, null);

    /** Settings with every field unset. */
    public static ClientConfig empty() {
        return EMPTY;
    }

    public ClientConfig withAddress(String address) {
        return new ClientConfig(address, scheme, stack);
    }

    public ClientConfig withScheme(String scheme) {
        return new ClientConfig(address, scheme, stack);
    }

    public ClientConfig withStack(String stack) {
        return new ClientConfig(address, scheme, stack);
    }
}
