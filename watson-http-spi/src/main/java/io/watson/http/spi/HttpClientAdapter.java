package io.watson.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the Watson client to work with different
 * HTTP client libraries (JDK HttpClient, Apache HttpClient, OkHttp, etc.)
 * without direct dependency on any specific implementation.
 *
 * <p>Implementations should be thread-safe and reusable. Connection pooling is
 * the responsibility of the wrapped library.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * try (HttpClientResponse response = adapter.send(request)) {
 *     ...
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with its body as a stream.
     *
     * <p>The caller must close the returned response on every path. Closing drains
     * whatever is left of the body and releases the connection back to the pool.
     *
     * @param request the HTTP request to send
     * @return the HTTP response
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
