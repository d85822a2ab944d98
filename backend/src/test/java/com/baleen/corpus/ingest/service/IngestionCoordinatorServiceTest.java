package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.model.FeedOutcome;
import com.baleen.corpus.ingest.model.FeedOutcomeStatus;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.persistence.StorageUnavailableException;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionCoordinatorServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-12T10:00:00Z");

    private IngestJdbcRepository repository;
    private FeedIngestionService feedIngestionService;
    private ExecutorService executor;
    private IngestionCoordinatorService coordinator;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(IngestJdbcRepository.class);
        feedIngestionService = Mockito.mock(FeedIngestionService.class);
        executor = Executors.newFixedThreadPool(4);
        coordinator = new IngestionCoordinatorService(repository, feedIngestionService, executor, Clock.fixed(NOW, ZoneOffset.UTC));
        when(repository.startJob(any())).thenReturn(11L, 12L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failingFeedDoesNotAffectHealthyFeed() {
        FeedRecord healthy = feed(1L, "https://healthy.example/feed");
        FeedRecord broken = feed(2L, "https://broken.example/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(healthy, broken));
        when(feedIngestionService.ingestFeed(healthy)).thenReturn(succeeded(healthy, 2, 1));
        when(feedIngestionService.ingestFeed(broken)).thenReturn(
            FeedOutcome.failed(broken, 0, 0, 0, ReasonCodeClassifier.HTTP_5XX, "HTTP 500", NOW));

        IngestionJob job = coordinator.runOnce();

        assertThat(job.id()).isEqualTo(11L);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
        assertThat(job.totals()).isEqualTo(new JobTotals(2, 1, 2, 1, 0));
        assertThat(job.outcomes()).extracting(FeedOutcome::feedId).containsExactlyInAnyOrder(1L, 2L);
        verify(repository, times(2)).appendJobOutcome(eq(11L), any());
        verify(repository).finalizeJob(eq(11L), eq(NOW), eq(JobStatus.COMPLETED_WITH_ERRORS), anyString(),
            eq(new JobTotals(2, 1, 2, 1, 0)));
    }

    @Test
    void unexpectedExceptionBecomesFailedOutcome() {
        FeedRecord healthy = feed(1L, "https://healthy.example/feed");
        FeedRecord exploding = feed(2L, "https://exploding.example/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(healthy, exploding));
        when(feedIngestionService.ingestFeed(healthy)).thenReturn(succeeded(healthy, 1, 0));
        when(feedIngestionService.ingestFeed(exploding)).thenThrow(new IllegalStateException("boom"));

        IngestionJob job = coordinator.runOnce();

        FeedOutcome failed = job.outcomes().stream().filter(o -> o.feedId() == 2L).findFirst().orElseThrow();
        assertThat(failed.status()).isEqualTo(FeedOutcomeStatus.FAILED);
        assertThat(failed.reasonCode()).isEqualTo(ReasonCodeClassifier.UNKNOWN);
        assertThat(failed.message()).contains("boom");
        assertThat(job.totals().newCount()).isEqualTo(1);
    }

    @Test
    void storageOutageForOneFeedIsReportedAsStorageUnavailable() {
        FeedRecord feed = feed(1L, "https://example.org/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(feed));
        when(feedIngestionService.ingestFeed(feed))
            .thenThrow(new StorageUnavailableException("Storage unavailable during postExists", new RuntimeException()));

        IngestionJob job = coordinator.runOnce();

        assertThat(job.outcomes().get(0).reasonCode()).isEqualTo(ReasonCodeClassifier.STORAGE_UNAVAILABLE);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
    }

    @Test
    void cancelledTickStartsNoFeeds() {
        FeedRecord first = feed(1L, "https://a.example/feed");
        FeedRecord second = feed(2L, "https://b.example/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(first, second));

        IngestionJob job = coordinator.run(() -> true);

        assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.outcomes()).extracting(FeedOutcome::status)
            .containsOnly(FeedOutcomeStatus.CANCELLED);
        assertThat(job.totals().feedsProcessed()).isZero();
        verify(feedIngestionService, never()).ingestFeed(any());
    }

    @Test
    void duplicateFeedRowsAreProcessedOnce() {
        FeedRecord feed = feed(1L, "https://example.org/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(feed, feed));
        when(feedIngestionService.ingestFeed(feed)).thenReturn(succeeded(feed, 0, 0));

        IngestionJob job = coordinator.runOnce();

        assertThat(job.outcomes()).hasSize(1);
        verify(feedIngestionService, times(1)).ingestFeed(feed);
    }

    @Test
    void feedStillInFlightFromAnotherJobIsSkipped() throws Exception {
        FeedRecord feed = feed(1L, "https://slow.example/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(feed));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(feedIngestionService.ingestFeed(feed)).thenAnswer(invocation -> {
            entered.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return succeeded(feed, 1, 0);
        });

        CompletableFuture<IngestionJob> firstJob = CompletableFuture.supplyAsync(coordinator::runOnce);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        IngestionJob secondJob = coordinator.runOnce();
        release.countDown();

        assertThat(secondJob.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(FeedOutcomeStatus.SKIPPED);
            assertThat(outcome.reasonCode()).isEqualTo(IngestionCoordinatorService.IN_FLIGHT);
        });
        assertThat(firstJob.get(5, TimeUnit.SECONDS).totals().newCount()).isEqualTo(1);
    }

    @Test
    void finalizeFailureMarksJobFailedAndRethrows() {
        FeedRecord feed = feed(1L, "https://example.org/feed");
        when(repository.findActiveFeeds()).thenReturn(List.of(feed));
        when(feedIngestionService.ingestFeed(feed)).thenReturn(succeeded(feed, 1, 0));
        when(repository.findJobOutcomes(11L)).thenReturn(List.of(succeeded(feed, 1, 0)));
        doThrow(new StorageUnavailableException("Storage unavailable during finalizeJob", new RuntimeException()))
            .when(repository).finalizeJob(anyLong(), any(), eq(JobStatus.COMPLETED), anyString(), any());

        assertThatThrownBy(() -> coordinator.runOnce()).isInstanceOf(StorageUnavailableException.class);

        ArgumentCaptor<JobTotals> totals = ArgumentCaptor.forClass(JobTotals.class);
        verify(repository).finalizeJob(eq(11L), eq(NOW), eq(JobStatus.FAILED), anyString(), totals.capture());
        assertThat(totals.getValue().newCount()).isEqualTo(1);
    }

    @Test
    void statusResolution() {
        FeedRecord feed = feed(1L, "https://example.org/feed");
        FeedOutcome ok = succeeded(feed, 1, 0);
        FeedOutcome failed = FeedOutcome.failed(feed, 0, 0, 0, ReasonCodeClassifier.HTTP_404, "HTTP 404", NOW);
        FeedOutcome cancelled = FeedOutcome.cancelled(feed, NOW);

        assertThat(IngestionCoordinatorService.resolveStatus(List.of())).isEqualTo(JobStatus.COMPLETED);
        assertThat(IngestionCoordinatorService.resolveStatus(List.of(ok))).isEqualTo(JobStatus.COMPLETED);
        assertThat(IngestionCoordinatorService.resolveStatus(List.of(ok, failed))).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
        assertThat(IngestionCoordinatorService.resolveStatus(List.of(failed, cancelled))).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void totalsDoNotDependOnCompletionOrder() {
        FeedRecord a = feed(1L, "https://a.example/feed");
        FeedRecord b = feed(2L, "https://b.example/feed");
        FeedRecord c = feed(3L, "https://c.example/feed");
        List<FeedOutcome> outcomes = new ArrayList<>(List.of(
            succeeded(a, 3, 2),
            FeedOutcome.failed(b, 1, 0, 4, ReasonCodeClassifier.STORAGE_UNAVAILABLE, "down", NOW),
            FeedOutcome.skipped(c, IngestionCoordinatorService.IN_FLIGHT, NOW)
        ));
        JobTotals forward = JobTotals.sum(outcomes);
        Collections.reverse(outcomes);
        JobTotals reversed = JobTotals.sum(outcomes);

        assertThat(forward).isEqualTo(reversed).isEqualTo(new JobTotals(2, 1, 4, 2, 4));
        JobTotals x = JobTotals.of(outcomes.get(0));
        JobTotals y = JobTotals.of(outcomes.get(1));
        assertThat(x.plus(y)).isEqualTo(y.plus(x));
    }

    private FeedRecord feed(long id, String url) {
        return new FeedRecord(id, url, "Feed " + id, null, Set.of(), null, null, null,
            FeedStatus.ACTIVE, 0, null, Map.of(), NOW, NOW);
    }

    private FeedOutcome succeeded(FeedRecord feed, int newCount, int duplicateCount) {
        return new FeedOutcome(feed.id(), feed.url(), newCount, duplicateCount, 0, FeedOutcomeStatus.SUCCEEDED,
            null, null, NOW);
    }
}
