package io.watson.http.spi;

/**
 * The request or its response did not complete within the configured timeout.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(HttpClientRequest request, Throwable cause) {
        super(request, "timed out", cause);
    }
}
