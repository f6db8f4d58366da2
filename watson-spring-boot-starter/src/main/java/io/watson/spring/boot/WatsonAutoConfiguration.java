package io.watson.spring.boot;

import io.watson.client.ConfigResolver;
import io.watson.client.ConfigSource;
import io.watson.client.ConnectionDescriptor;
import io.watson.client.WatsonClient;
import io.watson.http.spi.HttpClientAdapter;
import io.watson.http.spi.JdkHttpClientAdapter;
import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonCodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the Watson client.
 *
 * <p>Resolves the connection from {@link WatsonProperties} layered over the environment and
 * registers a ready {@link WatsonClient}. Every bean can be overridden by defining your own, for
 * example a different {@link HttpClientAdapter}:
 * <pre>{@code
 * @Bean
 * public HttpClientAdapter watsonHttpClient(OkHttpClient okHttp) {
 *     return OkHttpClientAdapter.create(okHttp);
 * }
 * }</pre>
 *
 * <p>An address with an unknown scheme prefix fails context startup.
 */
@AutoConfiguration
@ConditionalOnClass(WatsonClient.class)
@EnableConfigurationProperties(WatsonProperties.class)
public class WatsonAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(WatsonAutoConfiguration.class);

    /**
     * Fallback values for unset properties. Reads the process environment by default.
     */
    @Bean
    @ConditionalOnMissingBean
    public ConfigSource watsonConfigSource() {
        return ConfigSource.environment();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionDescriptor watsonConnection(WatsonProperties properties, ConfigSource source) {
        ConnectionDescriptor connection = new ConfigResolver(source).resolve(properties.toClientConfig());
        log.info("Resolved watson connection {}", connection);
        return connection;
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClientAdapter watsonHttpClient() {
        return JdkHttpClientAdapter.create();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec watsonJsonCodec() {
        return JsonCodecs.load();
    }

    @Bean
    @ConditionalOnMissingBean
    public WatsonClient watsonClient(ConnectionDescriptor connection, HttpClientAdapter http, JsonCodec json,
                                     WatsonProperties properties) {
        log.debug("Creating watson client with request timeout {}", properties.getRequestTimeout());
        return WatsonClient.builder()
                .connection(connection)
                .httpClient(http)
                .jsonCodec(json)
                .requestTimeout(properties.getRequestTimeout())
                .build();
    }
}
