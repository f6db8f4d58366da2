package io.watson.http.spi;

import java.io.InputStream;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>A response holds a pooled connection until it is closed. Use it in a
 * try-with-resources block; {@link #close()} drains the unread part of the
 * body first so the connection can be reused.
 */
public interface HttpClientResponse extends AutoCloseable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as a stream. Never null; empty when the response has no body.
     * The stream is closed by {@link #close()}.
     */
    InputStream body();

    /**
     * Drains and releases the response body. Never throws; drain failures only cost connection reuse.
     */
    @Override
    void close();
}
