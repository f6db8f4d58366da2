package io.watson.datasource;

import io.watson.client.ClientConfig;
import io.watson.client.ConfigResolver;
import io.watson.client.ConfigSource;
import io.watson.client.ConnectionDescriptor;
import io.watson.client.WatsonClient;
import io.watson.core.Protocol;
import io.watson.core.WatsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Host-facing entry point: validates the provider block, layers it over the environment and
 * builds the {@link WatsonClient} shared by the data sources.
 *
 * <p>Problems are reported as {@link Diagnostics}, never thrown.
 */
public final class WatsonProvider {
    private static final Logger log = LoggerFactory.getLogger(WatsonProvider.class);

    static final String ATTR_ADDRESS = "address";
    static final String ATTR_SCHEME = "scheme";
    static final String ATTR_STACK = "stack";

    private final ConfigSource source;
    private final Function<ConnectionDescriptor, WatsonClient> clientFactory;

    public WatsonProvider() {
        this(ConfigSource.environment());
    }

    public WatsonProvider(ConfigSource source) {
        this(source, WatsonClient::create);
    }

    public WatsonProvider(ConfigSource source, Function<ConnectionDescriptor, WatsonClient> clientFactory) {
        this.source = Objects.requireNonNull(source, "source");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    public ProviderConfiguration configure(ClientConfig config) {
        return configure(ProviderSettings.of(config));
    }

    public ProviderConfiguration configure(ProviderSettings settings) {
        Diagnostics diagnostics = new Diagnostics();

        if (settings.address().unknown()) {
            diagnostics.add(Diagnostic.attributeError(ATTR_ADDRESS, "Unknown watson API Host",
                    unknownDetail("host", Protocol.ENV_ADDRESS)));
        }
        if (settings.stack().unknown()) {
            diagnostics.add(Diagnostic.attributeError(ATTR_STACK, "Unknown watson API stack",
                    unknownDetail("stack", Protocol.ENV_STACK)));
        }
        if (settings.scheme().unknown()) {
            diagnostics.add(Diagnostic.attributeError(ATTR_SCHEME, "Unknown watson API scheme",
                    unknownDetail("scheme", Protocol.ENV_SCHEME)));
        }
        if (diagnostics.hasError()) {
            return new ProviderConfiguration(null, diagnostics);
        }

        ConnectionDescriptor connection;
        try {
            connection = new ConfigResolver(source).resolve(settings.toClientConfig());
        } catch (WatsonException e) {
            diagnostics.addError("Failed to create watson API client", e.getMessage());
            return new ProviderConfiguration(null, diagnostics);
        }

        if (connection.host().isEmpty()) {
            diagnostics.add(Diagnostic.attributeError(ATTR_ADDRESS, "Missing watson API Address",
                    missingDetail("address", Protocol.ENV_ADDRESS)));
        }
        if (!connection.hasStackDefault()) {
            diagnostics.add(Diagnostic.attributeError(ATTR_STACK, "Missing watson API stack",
                    missingDetail("stack", Protocol.ENV_STACK)));
        }
        if (diagnostics.hasError()) {
            return new ProviderConfiguration(null, diagnostics);
        }

        WatsonClient client;
        try {
            client = clientFactory.apply(connection);
        } catch (RuntimeException e) {
            diagnostics.addError("Failed to create watson API client", e.getMessage());
            return new ProviderConfiguration(null, diagnostics);
        }
        log.info("Configured watson client for {}", connection);
        return new ProviderConfiguration(client, diagnostics);
    }

    private static String unknownDetail(String field, String envKey) {
        return "The provider cannot create the watson API client as there is an unknown configuration value for the watson API "
                + field + ". Either target apply the source of the value first, set the value statically in the configuration, or use the "
                + envKey + " environment variable.";
    }

    private static String missingDetail(String field, String envKey) {
        return "The provider cannot create the watson API client as there is a missing or empty value for the watson API "
                + field + ". Set the " + field + " value in the configuration or use the " + envKey
                + " environment variable. If either is already set, ensure the value is not empty.";
    }
}
