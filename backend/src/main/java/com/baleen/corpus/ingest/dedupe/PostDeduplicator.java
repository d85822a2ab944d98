package com.baleen.corpus.ingest.dedupe;

import com.baleen.corpus.ingest.model.FeedEntry;
import com.baleen.corpus.ingest.model.PostDraft;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.persistence.InsertResult;
import com.baleen.corpus.ingest.util.HashUtils;
import com.baleen.corpus.ingest.util.UrlNormalizer;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class PostDeduplicator {
    private final IngestJdbcRepository repository;
    private final Clock clock;

    public PostDeduplicator(IngestJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Stable identity hash: the guid when present, otherwise the normalized link and title.
     */
    public static String fingerprint(FeedEntry entry) {
        if (entry.hasGuid()) {
            return HashUtils.sha256Hex("guid:" + entry.guid().trim());
        }
        return HashUtils.sha256Hex(
            "url:" + UrlNormalizer.normalizeForIdentity(entry.link())
                + "\ntitle:" + UrlNormalizer.normalizeTitle(entry.title())
        );
    }

    public boolean isKnown(String fingerprint) {
        return repository.postExists(fingerprint);
    }

    public DedupeOutcome insertIfNew(PostDraft draft) {
        InsertResult result = repository.insertPostIfNew(draft, clock.instant());
        return result == InsertResult.INSERTED ? DedupeOutcome.NEW : DedupeOutcome.DUPLICATE;
    }

    public enum DedupeOutcome {
        NEW,
        DUPLICATE
    }
}
