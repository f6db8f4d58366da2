package io.watson.core;

/**
 * Watson protocol constants (resource paths, header names, configuration keys).
 */
public final class Protocol {
    private Protocol() {}

    // Resource paths
    public static final String API_PREFIX = "/v1/projects/";
    public static final String OUTPUTS_SEGMENT = "outputs/";

    /** Identifies the calling stack; the service records it in the target's {@code used_by} list. */
    public static final String H_WATSON_STACK = "x-watson-stack";

    // HTTP headers
    public static final String H_ACCEPT = "Accept";

    // Content types
    public static final String CT_JSON = "application/json";

    // Status codes with protocol meaning
    public static final int STATUS_OK = 200;
    public static final int STATUS_NOT_FOUND = 404;

    // Configuration keys, read from the environment by default
    public static final String ENV_ADDRESS = "watson_ADDRESS";
    public static final String ENV_SCHEME = "watson_SCHEME";
    public static final String ENV_STACK = "watson_STACK";

    /** Scheme used when neither the environment nor the caller picks one. */
    public static final Scheme DEFAULT_SCHEME = Scheme.HTTPS;

    /** Separator between a scheme prefix and the rest of an address. */
    public static final String SCHEME_SEPARATOR = "://";

    /**
     * Path of the outputs resource of {@code stack}.
     */
    public static String outputsPath(StackName stack) {
        return API_PREFIX + stack.value() + "/" + OUTPUTS_SEGMENT;
    }

    /**
     * Path of a single output of {@code stack}.
     */
    public static String outputPath(StackName stack, String key) {
        return outputsPath(stack) + key + "/";
    }

    /**
     * Path of the metadata resource of {@code stack}.
     */
    public static String stackPath(StackName stack) {
        return API_PREFIX + stack.value() + "/";
    }
}
