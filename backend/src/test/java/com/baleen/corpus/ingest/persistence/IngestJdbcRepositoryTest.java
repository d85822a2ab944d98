package com.baleen.corpus.ingest.persistence;

import com.baleen.corpus.ingest.model.ExtractionStatus;
import com.baleen.corpus.ingest.model.FeedOutcome;
import com.baleen.corpus.ingest.model.FeedOutcomeStatus;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedRegistration;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.model.PostDraft;
import com.baleen.corpus.ingest.model.PostRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class IngestJdbcRepositoryTest {
    private static final Instant NOW = Instant.parse("2025-06-12T10:00:00Z");

    @Autowired
    private IngestJdbcRepository repository;

    @Test
    void upsertFeedIsIdempotentByUrl() {
        String url = uniqueUrl();
        long id = repository.upsertFeed(
            new FeedRegistration(url, "First", "https://example.org/", Set.of("news", "tech"), Map.of("language", "en")),
            NOW
        );
        long again = repository.upsertFeed(new FeedRegistration(url, null, null, Set.of(), Map.of()), NOW.plusSeconds(60));

        FeedRecord feed = repository.findFeedById(id);
        assertThat(again).isEqualTo(id);
        assertThat(feed.title()).isEqualTo("First");
        assertThat(feed.categories()).containsExactlyInAnyOrder("news", "tech");
        assertThat(feed.extensions()).containsEntry("language", "en");
        assertThat(feed.status()).isEqualTo(FeedStatus.ACTIVE);
        assertThat(feed.createdAt()).isEqualTo(NOW);
        assertThat(feed.updatedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(repository.findFeedByUrl(url).id()).isEqualTo(id);
    }

    @Test
    void fetchBookkeepingTracksHealth() {
        long id = repository.upsertFeed(new FeedRegistration(uniqueUrl(), "Feed", null, Set.of(), Map.of()), NOW);

        repository.recordFetchFailure(id, "TIMEOUT: read timed out", NOW);
        repository.recordFetchFailure(id, "TIMEOUT: read timed out", NOW.plusSeconds(1));
        FeedRecord failing = repository.findFeedById(id);
        assertThat(failing.status()).isEqualTo(FeedStatus.ERROR);
        assertThat(failing.consecutiveErrors()).isEqualTo(2);
        assertThat(failing.lastError()).startsWith("TIMEOUT");
        assertThat(repository.findActiveFeeds()).extracting(FeedRecord::id).contains(id);

        repository.recordFetchSuccess(id, "\"v1\"", "Wed, 11 Jun 2025 09:00:00 GMT", NOW.plusSeconds(2));
        repository.recordFetchSuccess(id, null, null, NOW.plusSeconds(3));
        FeedRecord healthy = repository.findFeedById(id);
        assertThat(healthy.status()).isEqualTo(FeedStatus.ACTIVE);
        assertThat(healthy.consecutiveErrors()).isZero();
        assertThat(healthy.lastError()).isNull();
        assertThat(healthy.etag()).isEqualTo("\"v1\"");
        assertThat(healthy.lastModified()).isEqualTo("Wed, 11 Jun 2025 09:00:00 GMT");
        assertThat(healthy.lastFetchedAt()).isEqualTo(NOW.plusSeconds(3));
    }

    @Test
    void inactiveFeedsStayInactiveAndAreNotScheduled() {
        long id = repository.upsertFeed(new FeedRegistration(uniqueUrl(), "Feed", null, Set.of("misc"), Map.of()), NOW);

        assertThat(repository.setFeedStatus(id, FeedStatus.INACTIVE, NOW)).isTrue();
        repository.recordFetchFailure(id, "HTTP_404", NOW);
        repository.recordFetchSuccess(id, null, null, NOW);

        assertThat(repository.findFeedById(id).status()).isEqualTo(FeedStatus.INACTIVE);
        assertThat(repository.findActiveFeeds()).extracting(FeedRecord::id).doesNotContain(id);
        assertThat(repository.findFeeds(FeedStatus.INACTIVE, "misc")).extracting(FeedRecord::id).contains(id);
        assertThat(repository.findFeeds(FeedStatus.INACTIVE, "other")).extracting(FeedRecord::id).doesNotContain(id);
        assertThat(repository.setFeedStatus(-1L, FeedStatus.ACTIVE, NOW)).isFalse();
    }

    @Test
    void postInsertIsIdempotentByFingerprint() {
        long feedId = repository.upsertFeed(new FeedRegistration(uniqueUrl(), "Feed", null, Set.of(), Map.of()), NOW);
        String fingerprint = UUID.randomUUID().toString().replace("-", "");
        OffsetDateTime published = OffsetDateTime.of(2025, 6, 10, 4, 0, 0, 0, ZoneOffset.UTC);
        PostDraft draft = new PostDraft(feedId, "https://example.org/p/1", "Post", published, "<p>body</p>",
            ExtractionStatus.FULL, fingerprint, "guid-1");

        assertThat(repository.postExists(fingerprint)).isFalse();
        assertThat(repository.insertPostIfNew(draft, NOW)).isEqualTo(InsertResult.INSERTED);
        assertThat(repository.insertPostIfNew(draft, NOW)).isEqualTo(InsertResult.ALREADY_EXISTS);
        assertThat(repository.postExists(fingerprint)).isTrue();

        PostRecord stored = repository.findPostByFingerprint(fingerprint);
        assertThat(stored.publishedAt()).isEqualTo(published);
        assertThat(stored.content()).isEqualTo("<p>body</p>");
        assertThat(stored.extractionStatus()).isEqualTo(ExtractionStatus.FULL);
    }

    @Test
    void onlyDegradedPostsCanBeUpgraded() {
        long feedId = repository.upsertFeed(new FeedRegistration(uniqueUrl(), "Feed", null, Set.of(), Map.of()), NOW);
        String degradedFp = UUID.randomUUID().toString().replace("-", "");
        String fullFp = UUID.randomUUID().toString().replace("-", "");
        repository.insertPostIfNew(new PostDraft(feedId, "https://example.org/d", "D", null, "<p>summary</p>",
            ExtractionStatus.DEGRADED_SUMMARY, degradedFp, null), NOW);
        repository.insertPostIfNew(new PostDraft(feedId, "https://example.org/f", "F", null, "<p>full</p>",
            ExtractionStatus.FULL, fullFp, null), NOW);
        PostRecord degraded = repository.findPostByFingerprint(degradedFp);
        PostRecord full = repository.findPostByFingerprint(fullFp);

        assertThat(repository.findDegradedPosts(500)).extracting(PostRecord::id).contains(degraded.id()).doesNotContain(full.id());
        assertThat(repository.updatePostExtraction(degraded.id(), "<p>article</p>", ExtractionStatus.FULL, NOW)).isTrue();
        assertThat(repository.updatePostExtraction(full.id(), "<p>changed</p>", ExtractionStatus.FULL, NOW)).isFalse();
        assertThat(repository.findPostByFingerprint(fullFp).content()).isEqualTo("<p>full</p>");
        assertThat(repository.findPostByFingerprint(degradedFp).content()).isEqualTo("<p>article</p>");

        List<PostRecord> visited = new ArrayList<>();
        repository.forEachPostInFeeds(List.of(feedId), visited::add);
        assertThat(visited).extracting(PostRecord::fingerprint).containsExactlyInAnyOrder(degradedFp, fullFp);
    }

    @Test
    void jobLedgerAcceptsOutcomesUntilFinalized() {
        long feedId = repository.upsertFeed(new FeedRegistration(uniqueUrl(), "Feed", null, Set.of(), Map.of()), NOW);
        long jobId = repository.startJob(NOW);
        FeedOutcome outcome = new FeedOutcome(feedId, "https://example.org/feed", 2, 1, 0,
            FeedOutcomeStatus.SUCCEEDED, null, null, NOW);

        repository.appendJobOutcome(jobId, outcome);
        assertThat(repository.findUnfinishedJobIds()).contains(jobId);
        JobTotals totals = JobTotals.sum(List.of(outcome));
        repository.finalizeJob(jobId, NOW.plusSeconds(5), JobStatus.COMPLETED, "feeds=1", totals);

        assertThatThrownBy(() -> repository.appendJobOutcome(jobId, outcome)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> repository.finalizeJob(jobId, NOW, JobStatus.FAILED, "again", totals))
            .isInstanceOf(IllegalStateException.class);
        assertThat(repository.findUnfinishedJobIds()).doesNotContain(jobId);

        IngestionJob job = repository.findJob(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.finishedAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(job.totals()).isEqualTo(new JobTotals(1, 0, 2, 1, 0));
        assertThat(job.outcomes()).singleElement().satisfies(stored -> {
            assertThat(stored.feedId()).isEqualTo(feedId);
            assertThat(stored.status()).isEqualTo(FeedOutcomeStatus.SUCCEEDED);
        });

        assertThat(repository.findJobs(null, null, JobStatus.COMPLETED, feedId, 10))
            .extracting(IngestionJob::id).containsExactly(jobId);
        assertThat(repository.findJobs(NOW.plusSeconds(1), null, null, feedId, 10)).isEmpty();
        assertThat(repository.findJobs(null, null, JobStatus.FAILED, feedId, 10)).isEmpty();
        assertThat(repository.findJob(-1L)).isNull();
    }

    @Test
    void tableCountsCoverAllTables() {
        assertThat(repository.isDbReachable()).isTrue();
        assertThat(repository.tableCounts()).containsKeys("feeds", "posts", "ingestion_jobs", "ingestion_job_outcomes");
    }

    private String uniqueUrl() {
        return "https://feeds.example.org/" + UUID.randomUUID() + ".xml";
    }
}
