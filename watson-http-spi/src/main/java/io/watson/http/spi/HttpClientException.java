package io.watson.http.spi;

import java.util.Objects;

/**
 * The request could not be completed: connection refused, DNS failure, broken stream or interrupt.
 * Receiving any HTTP status, including an error status, is not a failure at this level.
 */
public class HttpClientException extends Exception {
    private final transient HttpClientRequest request;

    public HttpClientException(HttpClientRequest request, Throwable cause) {
        this(request, describe(cause), cause);
    }

    public HttpClientException(HttpClientRequest request, String message, Throwable cause) {
        super(request + ": " + message, cause);
        this.request = Objects.requireNonNull(request, "request");
    }

    /**
     * The request that failed.
     */
    public HttpClientRequest request() {
        return request;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "failed";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
