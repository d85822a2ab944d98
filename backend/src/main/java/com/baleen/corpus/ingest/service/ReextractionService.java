package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.extract.ArticleContentExtractor;
import com.baleen.corpus.ingest.model.ArticleExtraction;
import com.baleen.corpus.ingest.model.ExtractionStatus;
import com.baleen.corpus.ingest.model.FeedEntry;
import com.baleen.corpus.ingest.model.PostRecord;
import com.baleen.corpus.ingest.model.ReextractionSummary;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Retries article extraction for posts stored with only their feed summary.
 */
@Service
public class ReextractionService {
    private static final Logger log = LoggerFactory.getLogger(ReextractionService.class);
    private static final int DEFAULT_LIMIT = 100;

    private final IngestJdbcRepository repository;
    private final ArticleContentExtractor extractor;
    private final Clock clock;

    public ReextractionService(IngestJdbcRepository repository, ArticleContentExtractor extractor, Clock clock) {
        this.repository = repository;
        this.extractor = extractor;
        this.clock = clock;
    }

    public ReextractionSummary reextractDegraded(Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        List<PostRecord> degraded = repository.findDegradedPosts(effectiveLimit);
        int upgraded = 0;
        for (PostRecord post : degraded) {
            FeedEntry entry = new FeedEntry(post.title(), post.url(), post.content(), post.publishedAt(), post.guid());
            ArticleExtraction extraction = extractor.extract(entry);
            if (extraction.isFull()
                && repository.updatePostExtraction(post.id(), extraction.html(), ExtractionStatus.FULL, clock.instant())) {
                upgraded++;
            }
        }
        log.info("Re-extraction attempted={} upgraded={}", degraded.size(), upgraded);
        return new ReextractionSummary(degraded.size(), upgraded, degraded.size() - upgraded);
    }
}
