package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.dedupe.PostDeduplicator;
import com.baleen.corpus.ingest.dedupe.PostDeduplicator.DedupeOutcome;
import com.baleen.corpus.ingest.extract.ArticleContentExtractor;
import com.baleen.corpus.ingest.fetch.FeedFetcher;
import com.baleen.corpus.ingest.model.ArticleExtraction;
import com.baleen.corpus.ingest.model.FeedEntry;
import com.baleen.corpus.ingest.model.FeedOutcome;
import com.baleen.corpus.ingest.model.FeedOutcomeStatus;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FetchOutcome;
import com.baleen.corpus.ingest.model.ParsedFeed;
import com.baleen.corpus.ingest.model.PostDraft;
import com.baleen.corpus.ingest.parse.FeedParseException;
import com.baleen.corpus.ingest.parse.FeedParser;
import com.baleen.corpus.ingest.persistence.StorageUnavailableException;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Runs one feed through fetch, parse, dedupe pre-check, extraction and insert. Every failure is
 * turned into a {@link FeedOutcome}; nothing escapes to the caller's job.
 */
@Service
public class FeedIngestionService {
    private static final Logger log = LoggerFactory.getLogger(FeedIngestionService.class);

    private final FeedFetcher feedFetcher;
    private final FeedParser feedParser;
    private final ArticleContentExtractor extractor;
    private final PostDeduplicator deduplicator;
    private final Clock clock;

    public FeedIngestionService(
        FeedFetcher feedFetcher,
        FeedParser feedParser,
        ArticleContentExtractor extractor,
        PostDeduplicator deduplicator,
        Clock clock
    ) {
        this.feedFetcher = feedFetcher;
        this.feedParser = feedParser;
        this.extractor = extractor;
        this.deduplicator = deduplicator;
        this.clock = clock;
    }

    public FeedOutcome ingestFeed(FeedRecord feed) {
        FetchOutcome fetch = feedFetcher.fetch(feed);
        if (fetch.isFailed()) {
            feedFetcher.recordFailure(feed, fetch.reasonCode(), fetch.message(), fetch.fetchedAt());
            return FeedOutcome.failed(feed, 0, 0, 0, fetch.reasonCode(), fetch.message(), clock.instant());
        }
        if (fetch.kind() == FetchOutcome.Kind.NOT_MODIFIED) {
            feedFetcher.recordSuccess(feed, fetch);
            log.info("Feed {} not modified", feed.url());
            return new FeedOutcome(feed.id(), feed.url(), 0, 0, 0, FeedOutcomeStatus.NOT_MODIFIED, null, null, clock.instant());
        }

        ParsedFeed parsed;
        try {
            parsed = feedParser.parse(fetch.body(), fetch.finalUrl());
        } catch (FeedParseException e) {
            log.warn("Feed {} could not be parsed: {}", feed.url(), e.getMessage());
            feedFetcher.recordFailure(feed, ReasonCodeClassifier.PARSING_FAILED, e.getMessage(), fetch.fetchedAt());
            return FeedOutcome.failed(feed, 0, 0, 0, ReasonCodeClassifier.PARSING_FAILED, e.getMessage(), clock.instant());
        }

        int newCount = 0;
        int duplicateCount = 0;
        int failedCount = parsed.skippedCount();
        try {
            for (FeedEntry entry : parsed.entries()) {
                try {
                    if (ingestEntry(feed, entry) == DedupeOutcome.NEW) {
                        newCount++;
                    } else {
                        duplicateCount++;
                    }
                } catch (StorageUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    failedCount++;
                    log.debug("Entry {} in feed {} failed: {}", entry.link(), feed.url(), e.getMessage());
                }
            }
        } catch (StorageUnavailableException e) {
            log.warn("Storage unavailable while ingesting feed {}: {}", feed.url(), e.getMessage());
            feedFetcher.recordFailure(feed, ReasonCodeClassifier.STORAGE_UNAVAILABLE, e.getMessage(), clock.instant());
            return FeedOutcome.failed(feed, newCount, duplicateCount, failedCount,
                ReasonCodeClassifier.STORAGE_UNAVAILABLE, e.getMessage(), clock.instant());
        }

        feedFetcher.recordSuccess(feed, fetch);
        log.info(
            "Feed {} ingested: new={} duplicate={} failed={}",
            feed.url(),
            newCount,
            duplicateCount,
            failedCount
        );
        return new FeedOutcome(
            feed.id(),
            feed.url(),
            newCount,
            duplicateCount,
            failedCount,
            FeedOutcomeStatus.SUCCEEDED,
            null,
            null,
            clock.instant()
        );
    }

    private DedupeOutcome ingestEntry(FeedRecord feed, FeedEntry entry) {
        String fingerprint = PostDeduplicator.fingerprint(entry);
        if (deduplicator.isKnown(fingerprint)) {
            return DedupeOutcome.DUPLICATE;
        }
        ArticleExtraction extraction = extractor.extract(entry);
        if (!extraction.isFull()) {
            log.debug("Degraded extraction for {}: {}", entry.link(), extraction.reason());
        }
        String url = extraction.canonicalUrl() == null ? entry.link() : extraction.canonicalUrl();
        PostDraft draft = new PostDraft(
            feed.id(),
            url,
            entry.title(),
            entry.publishedAt(),
            extraction.html(),
            extraction.status(),
            fingerprint,
            entry.guid()
        );
        return deduplicator.insertIfNew(draft);
    }
}
