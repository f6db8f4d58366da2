package io.watson.core;

/**
 * Base class for Watson client errors.
 *
 * <p>Every failure the client can report is one of the nested subclasses. A missing stack is not an
 * error and is reported as an empty result instead.
 */
public abstract class WatsonException extends RuntimeException {

    protected WatsonException(String message) {
        super(message);
    }

    protected WatsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an address embeds, or the configuration names, a scheme other than {@code http} or
     * {@code https}.
     */
    public static class InvalidScheme extends WatsonException {
        private final String scheme;

        public InvalidScheme(String scheme) {
            super("unknown protocol scheme: " + scheme);
            this.scheme = scheme;
        }

        public String scheme() {
            return scheme;
        }
    }

    /**
     * Raised before any request when a stack identifier is not of the form {@code namespace/name}.
     */
    public static class InvalidStackName extends WatsonException {
        private final String stackName;

        public InvalidStackName(String stackName) {
            super(quote(stackName) + " is not a valid stack name");
            this.stackName = stackName;
        }

        public String stackName() {
            return stackName;
        }
    }

    /**
     * Raised before any request when an output key cannot be used as a path segment.
     */
    public static class InvalidOutputName extends WatsonException {
        private final String outputName;

        public InvalidOutputName(String outputName) {
            super(quote(outputName) + " is not a valid output name");
            this.outputName = outputName;
        }

        public String outputName() {
            return outputName;
        }
    }

    /**
     * Raised when the configured host cannot be turned into a request URI.
     */
    public static class InvalidAddress extends WatsonException {
        private final String address;

        public InvalidAddress(String address, Throwable cause) {
            super(quote(address) + " is not a valid address", cause);
            this.address = address;
        }

        public String address() {
            return address;
        }
    }

    /**
     * Raised when the transport fails (connection refused, DNS failure, timeout).
     */
    public static class TransportFailure extends WatsonException {
        public TransportFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the service answers with a status other than 200 or 404.
     */
    public static class UnexpectedStatus extends WatsonException {
        private final int statusCode;

        public UnexpectedStatus(int statusCode) {
            super("unexpected status code: " + statusCode);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }

    /**
     * Raised when a 200 response body is not JSON of the expected shape.
     */
    public static class DecodeError extends WatsonException {
        public DecodeError(String message) {
            super(message);
        }

        public DecodeError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static String quote(String value) {
        return value == null ? "null" : '"' + value + '"';
    }
}
