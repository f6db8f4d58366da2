package io.watson.client;

import io.watson.core.Protocol;
import io.watson.core.Scheme;
import io.watson.core.WatsonException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Effective connection parameters produced by {@link ConfigResolver}. Immutable.
 *
 * @param host network address without scheme, e.g. {@code watson.example:8080}
 * @param scheme transport scheme
 * @param stackDefault calling stack, empty when none was configured
 * @param headers static headers sent with every request
 */
public record ConnectionDescriptor(String host, Scheme scheme, String stackDefault, Map<String, String> headers) {

    public ConnectionDescriptor {
        host = host == null ? "" : host;
        scheme = Objects.requireNonNull(scheme, "scheme");
        stackDefault = stackDefault == null ? "" : stackDefault;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Builds a descriptor, deriving the {@code x-watson-stack} header from {@code stackDefault}.
     */
    public static ConnectionDescriptor of(String host, Scheme scheme, String stackDefault) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (stackDefault != null && !stackDefault.isEmpty()) {
            headers.put(Protocol.H_WATSON_STACK, stackDefault);
        }
        return new ConnectionDescriptor(host, scheme, stackDefault, headers);
    }

    public boolean hasStackDefault() {
        return !stackDefault.isEmpty();
    }

    /**
     * Resolves an absolute path against this descriptor's scheme and host.
     *
     * @param path absolute path, e.g. {@code /v1/projects/a/b/}
     * <p>Hosts that are not valid DNS names, such as {@code watson_api:8000}, resolve to a URI with a
     * registry-based authority. Whether they can be reached is up to the transport.
     *
     * @throws WatsonException.InvalidAddress if the host is empty or cannot form a URI authority
     */
    public URI resolve(String path) {
        if (host.isEmpty()) {
            throw new WatsonException.InvalidAddress(host, null);
        }
        URI uri;
        try {
            uri = new URI(scheme.value(), host, path, null, null);
        } catch (URISyntaxException e) {
            throw new WatsonException.InvalidAddress(host, e);
        }
        return uri;
    }

    @Override
    public String toString() {
        return scheme + "://" + host + (hasStackDefault() ? " (stack " + stackDefault + ")" : "");
    }
}
