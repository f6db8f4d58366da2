package io.watson.datasource;

import io.watson.client.WatsonClient;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link WatsonProvider#configure}: a client when configuration succeeded, and the
 * diagnostics gathered on the way.
 */
public final class ProviderConfiguration {
    private final WatsonClient client;
    private final Diagnostics diagnostics;

    ProviderConfiguration(WatsonClient client, Diagnostics diagnostics) {
        this.client = client;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * The configured client, empty whenever {@link #diagnostics()} holds an error.
     */
    public Optional<WatsonClient> client() {
        return Optional.ofNullable(client);
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    /**
     * Data source for stack outputs bound to the configured client.
     *
     * @throws IllegalStateException if configuration failed
     */
    public OutputsDataSource outputs() {
        return new OutputsDataSource(requireClient());
    }

    /**
     * Data source for stack metadata bound to the configured client.
     *
     * @throws IllegalStateException if configuration failed
     */
    public StackDataSource stacks() {
        return new StackDataSource(requireClient());
    }

    private WatsonClient requireClient() {
        if (client == null) {
            throw new IllegalStateException("provider is not configured: " + diagnostics.errors());
        }
        return client;
    }
}
