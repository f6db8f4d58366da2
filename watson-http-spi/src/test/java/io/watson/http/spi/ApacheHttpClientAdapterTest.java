package io.watson.http.spi;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;

class ApacheHttpClientAdapterTest extends AbstractHttpClientAdapterTest {

    private CloseableHttpClient client;

    @Override
    protected HttpClientAdapter createAdapter() {
        client = HttpClients.createDefault();
        return ApacheHttpClientAdapter.create(client);
    }

    @Override
    protected void closeAdapter() throws Exception {
        client.close();
    }
}
