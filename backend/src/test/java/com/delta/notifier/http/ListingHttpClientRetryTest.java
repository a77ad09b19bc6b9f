package com.delta.notifier.http;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ListingHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorsThenSucceeds() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("| Company |"));
        server.start();

        ListingHttpClient client = newClient(2);
        HttpFetchResult result = client.get(server.url("/README.md").toString(), "text/plain");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("| Company |");
        assertThat(server.getRequestCount()).isEqualTo(2);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).startsWith("delta-listing-notifier/0.1");
        assertThat(request.getHeader("Accept")).isEqualTo("text/plain");
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
        server.start();

        ListingHttpClient client = newClient(2);
        HttpFetchResult result = client.get(server.url("/README.md").toString(), null);

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void giveUpAfterConfiguredRetries() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("never reached"));
        server.start();

        ListingHttpClient client = newClient(1);
        HttpFetchResult result = client.get(server.url("/README.md").toString(), "text/plain");

        assertThat(result.statusCode()).isEqualTo(502);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void malformedUrlIsReportedWithoutRequest() {
        ListingHttpClient client = newClient(2);
        HttpFetchResult result = client.get("http://", "text/plain");
        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.isSuccessful()).isFalse();
    }

    private ListingHttpClient newClient(int maxRetries) {
        NotifierProperties properties = new NotifierProperties();
        properties.getSource().setRequestTimeoutSeconds(5);
        properties.getSource().setRequestMaxRetries(maxRetries);
        properties.getSource().setRequestRetryBaseDelayMs(1);
        properties.getSource().setRequestRetryMaxDelayMs(5);
        executor = Executors.newFixedThreadPool(1);
        return new ListingHttpClient(properties, executor);
    }
}
