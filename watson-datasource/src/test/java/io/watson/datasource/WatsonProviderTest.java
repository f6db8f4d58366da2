package io.watson.datasource;

import io.watson.client.ClientConfig;
import io.watson.client.ConfigSource;
import io.watson.client.ConnectionDescriptor;
import io.watson.client.WatsonClient;
import io.watson.core.Scheme;
import io.watson.http.spi.JdkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatsonProviderTest {

    private final List<ConnectionDescriptor> created = new ArrayList<>();

    private WatsonProvider provider(Map<String, String> env) {
        return new WatsonProvider(ConfigSource.of(env), connection -> {
            created.add(connection);
            return new StubWatsonClient();
        });
    }

    @Test
    void configuresFromExplicitSettings() {
        ProviderConfiguration configuration = provider(Map.of())
                .configure(new ClientConfig("watson.internal", "http", "frontend/dev"));

        assertThat(configuration.diagnostics().isEmpty()).isTrue();
        assertThat(configuration.client()).isPresent();
        assertThat(created).containsExactly(ConnectionDescriptor.of("watson.internal", Scheme.HTTP, "frontend/dev"));
    }

    @Test
    void fillsFromEnvironment() {
        ProviderConfiguration configuration = provider(Map.of("watson_ADDRESS", "https://env-host", "watson_STACK", "ops/env"))
                .configure(ClientConfig.empty());

        assertThat(configuration.diagnostics().hasError()).isFalse();
        assertThat(created).containsExactly(ConnectionDescriptor.of("env-host", Scheme.HTTPS, "ops/env"));
    }

    @Test
    void unknownValuesBlockConfiguration() {
        ProviderSettings settings = new ProviderSettings(Setting.unknownValue(), Setting.unknownValue(), Setting.unknownValue());

        ProviderConfiguration configuration = provider(Map.of("watson_ADDRESS", "h", "watson_STACK", "a/b")).configure(settings);

        assertThat(configuration.client()).isEmpty();
        assertThat(configuration.diagnostics().errors())
                .extracting(Diagnostic::summary)
                .containsExactly("Unknown watson API Host", "Unknown watson API stack", "Unknown watson API scheme");
        assertThat(configuration.diagnostics().errors())
                .extracting(Diagnostic::attribute)
                .containsExactly("address", "stack", "scheme");
        assertThat(configuration.diagnostics().errors().get(0).detail()).contains("watson_ADDRESS");
        assertThat(created).isEmpty();
    }

    @Test
    void missingAddressAndStackAreReported() {
        ProviderConfiguration configuration = provider(Map.of()).configure(ProviderSettings.empty());

        assertThat(configuration.client()).isEmpty();
        assertThat(configuration.diagnostics().errors())
                .extracting(Diagnostic::summary)
                .containsExactly("Missing watson API Address", "Missing watson API stack");
        assertThat(configuration.diagnostics().errors().get(1).detail()).contains("watson_STACK");
        assertThat(created).isEmpty();
    }

    @Test
    void resolverFailureIsReported() {
        ProviderConfiguration configuration = provider(Map.of())
                .configure(new ClientConfig("ftp://host", null, "a/b"));

        assertThat(configuration.diagnostics().errors()).containsExactly(
                Diagnostic.error("Failed to create watson API client", "unknown protocol scheme: ftp"));
    }

    @Test
    void clientFactoryFailureIsReported() {
        WatsonProvider provider = new WatsonProvider(ConfigSource.none(), connection -> {
            throw new IllegalStateException("no codec");
        });

        ProviderConfiguration configuration = provider.configure(new ClientConfig("h", null, "a/b"));

        assertThat(configuration.diagnostics().errors()).containsExactly(
                Diagnostic.error("Failed to create watson API client", "no codec"));
    }

    @Test
    void dataSourcesNeedAClient() {
        ProviderConfiguration configuration = provider(Map.of()).configure(ClientConfig.empty());

        assertThatThrownBy(configuration::outputs).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(configuration::stacks).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void readsOutputsThroughConfiguredClient() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse()
                    .setResponseCode(200)
                    .addHeader("Content-Type", "application/json")
                    .setBody("{\"hostname\": {\"value\": \"https://hello.eu-central-1.blabla\", \"sensitive\": false, "
                            + "\"deprecated\": \"\", \"warning\": \"\"}, \"count\": {\"value\": 3}}"));
            server.start();

            HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            WatsonProvider provider = new WatsonProvider(
                    ConfigSource.of(Map.of("watson_SCHEME", "http", "watson_STACK", "frontend/dev")),
                    connection -> WatsonClient.builder()
                            .connection(connection)
                            .httpClient(JdkHttpClientAdapter.create(http))
                            .build());

            ProviderConfiguration configuration = provider.configure(
                    ClientConfig.empty().withAddress(server.getHostName() + ":" + server.getPort()));
            OutputsReadResult result = configuration.outputs().read("backend/load-balancers");

            assertThat(result.outputs().get("hostname"))
                    .isEqualTo(new OutputAttributes("https://hello.eu-central-1.blabla", false, "", ""));
            assertThat(result.diagnostics().warnings()).extracting(Diagnostic::summary).containsExactly("ignored output");

            RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request.getPath()).isEqualTo("/v1/projects/backend/load-balancers/outputs/");
            assertThat(request.getHeader("x-watson-stack")).isEqualTo("frontend/dev");
        }
    }
}
