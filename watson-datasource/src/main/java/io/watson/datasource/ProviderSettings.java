package io.watson.datasource;

import io.watson.client.ClientConfig;

import java.util.Objects;

/**
 * Provider block as configured by the host: one {@link Setting} per connection field.
 */
public record ProviderSettings(Setting address, Setting scheme, Setting stack) {

    public ProviderSettings {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(stack, "stack");
    }

    public static ProviderSettings of(ClientConfig config) {
        return new ProviderSettings(Setting.of(config.address()), Setting.of(config.scheme()), Setting.of(config.stack()));
    }

    public static ProviderSettings empty() {
        return new ProviderSettings(Setting.unset(), Setting.unset(), Setting.unset());
    }

    public ProviderSettings withAddress(Setting address) {
        return new ProviderSettings(address, scheme, stack);
    }

    public ProviderSettings withScheme(Setting scheme) {
        return new ProviderSettings(address, scheme, stack);
    }

    public ProviderSettings withStack(Setting stack) {
        return new ProviderSettings(address, scheme, stack);
    }

    ClientConfig toClientConfig() {
        return new ClientConfig(address.value(), scheme.value(), stack.value());
    }
}
