package io.watson.client;

import io.watson.core.Protocol;
import io.watson.core.StackName;
import io.watson.core.WatsonException;
import io.watson.http.spi.HttpClientAdapter;
import io.watson.http.spi.HttpClientException;
import io.watson.http.spi.HttpClientRequest;
import io.watson.http.spi.HttpClientResponse;
import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonException;
import io.watson.json.spi.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class DefaultWatsonClient implements WatsonClient {

    private final ConnectionDescriptor connection;
    private final HttpClientAdapter http;
    private final JsonCodec json;
    private final Duration requestTimeout;

    public DefaultWatsonClient(ConnectionDescriptor connection, HttpClientAdapter http, JsonCodec json) {
        this(connection, http, json, null);
    }

    public DefaultWatsonClient(ConnectionDescriptor connection, HttpClientAdapter http, JsonCodec json, Duration requestTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Optional<Outputs> fetchOutputs(String stack) {
        StackName name = StackName.parse(stack);
        return get(Protocol.outputsPath(name), PayloadDecoder::decodeOutputs);
    }

    @Override
    public Optional<Output> fetchOutput(String stack, String key) {
        StackName name = StackName.parse(stack);
        if (key == null || key.isEmpty() || key.indexOf('/') >= 0 || key.indexOf('.') >= 0) {
            throw new WatsonException.InvalidOutputName(key);
        }
        return get(Protocol.outputPath(name, key), node -> PayloadDecoder.decodeOutput(key, node));
    }

    @Override
    public Optional<Stack> fetchStack(String stack) {
        StackName name = StackName.parse(stack);
        return get(Protocol.stackPath(name), PayloadDecoder::decodeStack);
    }

    @Override
    public ConnectionDescriptor connection() {
        return connection;
    }

    private <T> Optional<T> get(String path, Function<JsonNode, T> decoder) {
        URI uri = connection.resolve(path);
        HttpClientRequest request = HttpClientRequest.get(uri)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON)
                .headers(connection.headers())
                .timeout(requestTimeout)
                .build();

        try (HttpClientResponse response = send(request)) {
            int status = response.statusCode();
            if (status == Protocol.STATUS_NOT_FOUND) {
                return Optional.empty();
            }
            if (status != Protocol.STATUS_OK) {
                throw new WatsonException.UnexpectedStatus(status);
            }
            JsonNode root;
            try {
                root = json.readTree(response.body());
            } catch (JsonException e) {
                throw new WatsonException.DecodeError("invalid JSON in response to " + request, e);
            }
            return Optional.of(decoder.apply(root));
        }
    }

    private HttpClientResponse send(HttpClientRequest request) {
        try {
            return http.send(request);
        } catch (HttpClientException e) {
            throw new WatsonException.TransportFailure(e.getMessage(), e);
        }
    }
}
