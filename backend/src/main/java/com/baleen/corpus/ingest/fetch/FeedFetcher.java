package com.baleen.corpus.ingest.fetch;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.http.PoliteHttpClient;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FetchOutcome;
import com.baleen.corpus.ingest.model.HttpFetchResult;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conditional feed fetching plus the feed health bookkeeping that follows it.
 */
@Service
public class FeedFetcher {
    private static final Logger log = LoggerFactory.getLogger(FeedFetcher.class);
    static final String ACCEPT_FEED =
        "application/rss+xml,application/atom+xml,application/rdf+xml,application/xml;q=0.9,text/xml;q=0.8,*/*;q=0.1";

    private final PoliteHttpClient httpClient;
    private final IngestJdbcRepository repository;
    private final IngestProperties properties;
    private final Clock clock;

    public FeedFetcher(
        PoliteHttpClient httpClient,
        IngestJdbcRepository repository,
        IngestProperties properties,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public FetchOutcome fetch(FeedRecord feed) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (feed.etag() != null && !feed.etag().isBlank()) {
            headers.put("If-None-Match", feed.etag());
        }
        if (feed.lastModified() != null && !feed.lastModified().isBlank()) {
            headers.put("If-Modified-Since", feed.lastModified());
        }

        HttpFetchResult result = httpClient.get(
            feed.url(),
            ACCEPT_FEED,
            headers,
            properties.getRetry().getMaxAttempts()
        );
        Instant fetchedAt = clock.instant();
        if (result.isNotModified()) {
            return FetchOutcome.notModified(result.etag(), result.lastModified(), fetchedAt);
        }
        if (result.isSuccessful()) {
            return FetchOutcome.modified(
                result.bodyBytes(),
                result.finalUrlOrRequested(),
                result.etag(),
                result.lastModified(),
                fetchedAt
            );
        }

        String reason = ReasonCodeClassifier.classify(result);
        String message = result.errorCode() != null
            ? result.errorCode() + ": " + result.errorMessage()
            : "HTTP " + result.statusCode();
        log.warn("Feed fetch failed for {} after {} attempt(s): {} ({})", feed.url(), result.attempts(), reason, message);
        return FetchOutcome.failed(reason, message, ReasonCodeClassifier.isPermanent(reason), fetchedAt);
    }

    /**
     * Marks the feed healthy and stores the validators from a MODIFIED or NOT_MODIFIED fetch.
     */
    public void recordSuccess(FeedRecord feed, FetchOutcome outcome) {
        Instant fetchedAt = outcome.fetchedAt() == null ? clock.instant() : outcome.fetchedAt();
        try {
            repository.recordFetchSuccess(feed.id(), outcome.etag(), outcome.lastModified(), fetchedAt);
        } catch (RuntimeException e) {
            log.warn("Unable to record fetch success for feed {}: {}", feed.id(), e.getMessage());
        }
    }

    public void recordFailure(FeedRecord feed, String reasonCode, String message, Instant at) {
        String lastError = message == null || message.isBlank() ? reasonCode : reasonCode + ": " + message;
        try {
            repository.recordFetchFailure(feed.id(), lastError, at == null ? clock.instant() : at);
        } catch (RuntimeException e) {
            log.warn("Unable to record fetch failure for feed {}: {}", feed.id(), e.getMessage());
        }
    }
}
