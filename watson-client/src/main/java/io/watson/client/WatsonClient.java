package io.watson.client;

import java.util.Optional;

/**
 * Read-only client for a Watson service.
 *
 * <p>All operations are synchronous. Stack identifiers are validated before any request is made.
 * A stack or output the service does not know is reported as an empty result; every other failure
 * is a {@link io.watson.core.WatsonException}.
 *
 * <p>Implementations are immutable and safe for concurrent use.
 */
public interface WatsonClient {

    /**
     * Fetches every output of {@code stack}.
     *
     * @param stack identifier of the form {@code namespace/name}
     * @return the outputs, or empty if the stack does not exist
     * @throws io.watson.core.WatsonException.InvalidStackName if {@code stack} is malformed
     * @throws io.watson.core.WatsonException.UnexpectedStatus for any status other than 200 or 404
     * @throws io.watson.core.WatsonException.DecodeError if the body is not a valid outputs payload
     * @throws io.watson.core.WatsonException.TransportFailure if the request could not be completed
     */
    Optional<Outputs> fetchOutputs(String stack);

    /**
     * Fetches a single output of {@code stack}.
     *
     * @param stack identifier of the form {@code namespace/name}
     * @param key output name, without {@code /} or {@code .}
     * @return the output, or empty if the stack or the output does not exist
     */
    Optional<Output> fetchOutput(String stack, String key);

    /**
     * Fetches the metadata of {@code stack}, including the stacks that use it.
     *
     * @param stack identifier of the form {@code namespace/name}
     * @return the stack, or empty if it does not exist
     */
    Optional<Stack> fetchStack(String stack);

    /**
     * The connection this client sends requests to.
     */
    ConnectionDescriptor connection();

    static WatsonClient create(ConnectionDescriptor connection) {
        return builder().connection(connection).build();
    }

    static WatsonClientBuilder builder() {
        return new WatsonClientBuilder();
    }
}
