package io.watson.http.spi;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {
    private static final Logger log = LoggerFactory.getLogger(OkHttpClientAdapter.class);

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        log.debug("{}", request);
        try {
            Response response = clientWithTimeout(request).newCall(toOkHttpRequest(request)).execute();
            return new StreamingResponse(response);
        } catch (InterruptedIOException e) {
            // covers SocketTimeoutException and OkHttp's call timeout
            throw new HttpTimeoutException(request, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(request, e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString())
                .method(request.method(), null);

        request.headers().forEach(builder::header);
        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final Response response;
        private final InputStream body;

        StreamingResponse(Response response) {
            this.response = response;
            ResponseBody responseBody = response.body();
            this.body = ResponseBodies.orEmpty(responseBody != null ? responseBody.byteStream() : null);
        }

        @Override public int statusCode() { return response.code(); }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(response.header(name)); }
        @Override public InputStream body() { return body; }

        @Override
        public void close() {
            ResponseBodies.drainAndClose(body);
            response.close();
        }
    }
}
