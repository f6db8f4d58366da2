package io.watson.spring.boot;

import io.watson.client.ClientConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Watson client.
 *
 * <p>Configure via application properties:
 * <pre>
 * watson.address=watson.internal:8443
 * watson.scheme=https
 * watson.stack=frontend/dev
 * watson.request-timeout=5s
 * </pre>
 * Unset values fall back to the {@code watson_ADDRESS}, {@code watson_SCHEME} and
 * {@code watson_STACK} environment variables.
 */
@ConfigurationProperties("watson")
public class WatsonProperties {

    private String address;
    private String scheme;
    private String stack;
    private Duration requestTimeout;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getScheme() {
        return scheme;
    }

    public void setScheme(String scheme) {
        this.scheme = scheme;
    }

    public String getStack() {
        return stack;
    }

    public void setStack(String stack) {
        this.stack = stack;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    ClientConfig toClientConfig() {
        return new ClientConfig(address, scheme, stack);
    }
}
