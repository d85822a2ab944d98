package com.baleen.corpus.ingest.http;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.HttpFetchResult;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        IngestProperties properties = new IngestProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutMs(2_000);
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBaseDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        properties.setUserAgent("baleen-test/1.0");

        executor = Executors.newFixedThreadPool(2);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        HttpFetchResult result = client.get(server.url("/flaky").toString(), "text/plain");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(new String(result.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("ok");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        HttpFetchResult result = client.get(server.url("/down").toString(), "text/plain");

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(ReasonCodeClassifier.classify(result)).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
    }

    @Test
    void doesNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/gone").toString(), "text/plain");

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void sendsConditionalAndIdentityHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(304).setHeader("ETag", "\"v2\""));

        HttpFetchResult result = client.get(
            server.url("/feed").toString(),
            "application/rss+xml",
            Map.of("If-None-Match", "\"v1\"", "If-Modified-Since", "Tue, 10 Jun 2025 04:00:00 GMT"),
            1
        );

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("If-None-Match")).isEqualTo("\"v1\"");
        assertThat(request.getHeader("If-Modified-Since")).isEqualTo("Tue, 10 Jun 2025 04:00:00 GMT");
        assertThat(request.getHeader("User-Agent")).isEqualTo("baleen-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/rss+xml");
        assertThat(result.isNotModified()).isTrue();
        assertThat(result.etag()).isEqualTo("\"v2\"");
    }

    @Test
    void invalidUrlFailsWithoutRequest() {
        HttpFetchResult result = client.get("notaurl", "text/plain");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isZero();
    }
}
