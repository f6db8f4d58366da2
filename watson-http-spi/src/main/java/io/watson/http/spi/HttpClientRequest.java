package io.watson.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A bodiless request for an {@link HttpClientAdapter}.
 *
 * @param uri absolute target
 * @param method HTTP method, usually {@code GET}
 * @param headers request headers, sent in iteration order
 * @param timeout per-request timeout, {@code null} to keep the wrapped client's own limits
 */
public record HttpClientRequest(URI uri, String method, Map<String, String> headers, Duration timeout) {

    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder get(URI uri) {
        return new Builder(uri, "GET");
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, timeout);
        }
    }
}
