package io.watson.client;

import io.watson.core.Protocol;
import io.watson.core.Scheme;
import io.watson.core.WatsonException;

import java.util.Objects;
import java.util.Optional;

/**
 * Merges caller settings, a {@link ConfigSource} and the defaults into a {@link ConnectionDescriptor}.
 *
 * <p>Precedence, lowest first:
 * <ol>
 *   <li>defaults: scheme {@code https}, empty host, no stack</li>
 *   <li>{@code watson_ADDRESS}, {@code watson_SCHEME}, {@code watson_STACK} from the source</li>
 *   <li>non-empty fields of the {@link ClientConfig}</li>
 *   <li>a scheme prefix embedded in the address ({@code http://host} or {@code https://host})</li>
 * </ol>
 */
public final class ConfigResolver {

    private final ConfigSource source;

    public ConfigResolver(ConfigSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * A resolver reading its fallbacks from the process environment.
     */
    public static ConfigResolver fromEnvironment() {
        return new ConfigResolver(ConfigSource.environment());
    }

    /**
     * Resolves {@code config} into an effective descriptor.
     *
     * @throws WatsonException.InvalidScheme if the address embeds a prefix other than {@code http} or
     *         {@code https}, or the effective scheme setting is not one of them
     */
    public ConnectionDescriptor resolve(ClientConfig config) {
        Objects.requireNonNull(config, "config");

        String host = firstNonEmpty(config.address(), Protocol.ENV_ADDRESS).orElse("");
        String scheme = firstNonEmpty(config.scheme(), Protocol.ENV_SCHEME).orElse(Protocol.DEFAULT_SCHEME.value());
        String stack = firstNonEmpty(config.stack(), Protocol.ENV_STACK).orElse("");

        int sep = host.indexOf(Protocol.SCHEME_SEPARATOR);
        if (sep >= 0) {
            // the embedded prefix wins over any scheme setting
            scheme = Scheme.parse(host.substring(0, sep)).value();
            host = host.substring(sep + Protocol.SCHEME_SEPARATOR.length());
        }

        return ConnectionDescriptor.of(host, Scheme.parse(scheme), stack);
    }

    private Optional<String> firstNonEmpty(String explicit, String key) {
        if (explicit != null && !explicit.isEmpty()) {
            return Optional.of(explicit);
        }
        return source.get(key).filter(v -> !v.isEmpty());
    }
}
