package io.watson.http.spi;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {
    private static final Logger log = LoggerFactory.getLogger(ApacheHttpClientAdapter.class);

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        log.debug("{}", request);
        try {
            ClassicHttpResponse response = httpClient.executeOpen(null, toApacheRequest(request), null);
            try {
                return new StreamingResponse(response);
            } catch (IOException e) {
                response.close();
                throw e;
            }
        } catch (InterruptedIOException e) {
            throw new HttpTimeoutException(request, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(request, e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        request.headers().forEach(apacheRequest::setHeader);

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final ClassicHttpResponse response;
        private final InputStream body;

        StreamingResponse(ClassicHttpResponse response) throws IOException {
            this.response = response;
            HttpEntity entity = response.getEntity();
            this.body = ResponseBodies.orEmpty(entity != null ? entity.getContent() : null);
        }

        @Override public int statusCode() { return response.getCode(); }

        @Override
        public Optional<String> header(String name) {
            Header h = response.getFirstHeader(name);
            return h == null ? Optional.empty() : Optional.ofNullable(h.getValue());
        }

        @Override public InputStream body() { return body; }

        @Override
        public void close() {
            // reaching EOF hands the connection back to the pool before close() can discard it
            ResponseBodies.drainAndClose(body);
            try {
                response.close();
            } catch (IOException e) {
                log.debug("Failed to release response", e);
            }
        }
    }
}
