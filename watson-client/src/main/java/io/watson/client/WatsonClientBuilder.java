package io.watson.client;

import io.watson.http.spi.HttpClientAdapter;
import io.watson.http.spi.JdkHttpClientAdapter;
import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

public final class WatsonClientBuilder {
    private ConnectionDescriptor connection;
    private ClientConfig config;
    private ConfigSource configSource;
    private HttpClientAdapter httpClient;
    private JsonCodec jsonCodec;
    private Duration requestTimeout;

    WatsonClientBuilder() {}

    /**
     * Uses an already resolved connection. Takes precedence over {@link #config(ClientConfig)}.
     */
    public WatsonClientBuilder connection(ConnectionDescriptor connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        return this;
    }

    /**
     * Resolves the connection from {@code config} at build time.
     */
    public WatsonClientBuilder config(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    /**
     * Fallback source for {@link #config(ClientConfig)}; defaults to the process environment.
     */
    public WatsonClientBuilder configSource(ConfigSource configSource) {
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        return this;
    }

    public WatsonClientBuilder httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public WatsonClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public WatsonClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Per-request timeout handed to the transport. Unset by default.
     */
    public WatsonClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * @throws io.watson.core.WatsonException.InvalidScheme if the connection has to be resolved and
     *         names an unknown scheme
     */
    public WatsonClient build() {
        ConnectionDescriptor resolved = connection;
        if (resolved == null) {
            ConfigSource source = configSource != null ? configSource : ConfigSource.environment();
            resolved = new ConfigResolver(source).resolve(config != null ? config : ClientConfig.empty());
        }
        HttpClientAdapter transport = httpClient != null ? httpClient : JdkHttpClientAdapter.create();
        JsonCodec codec = jsonCodec != null ? jsonCodec : JsonCodecs.load();
        return new DefaultWatsonClient(resolved, transport, codec, requestTimeout);
    }
}
