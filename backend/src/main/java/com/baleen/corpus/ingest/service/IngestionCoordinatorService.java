package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.model.FeedOutcome;
import com.baleen.corpus.ingest.model.FeedOutcomeStatus;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.persistence.StorageUnavailableException;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.BooleanSupplier;

/**
 * Runs one ingestion tick: opens a job, fans feeds out over the bounded ingest pool, appends each
 * feed's outcome as it completes and finalizes the job with the folded totals.
 */
@Service
public class IngestionCoordinatorService {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinatorService.class);
    static final String IN_FLIGHT = "IN_FLIGHT";

    private final IngestJdbcRepository repository;
    private final FeedIngestionService feedIngestionService;
    private final ExecutorService ingestExecutor;
    private final Clock clock;
    private final Set<Long> inFlightFeeds = ConcurrentHashMap.newKeySet();

    public IngestionCoordinatorService(
        IngestJdbcRepository repository,
        FeedIngestionService feedIngestionService,
        @Qualifier("ingestExecutor") ExecutorService ingestExecutor,
        Clock clock
    ) {
        this.repository = repository;
        this.feedIngestionService = feedIngestionService;
        this.ingestExecutor = ingestExecutor;
        this.clock = clock;
    }

    public IngestionJob runOnce() {
        return run(() -> false);
    }

    public IngestionJob run(BooleanSupplier cancelled) {
        BooleanSupplier cancelSignal = cancelled == null ? () -> false : cancelled;
        Map<Long, FeedRecord> feeds = new LinkedHashMap<>();
        for (FeedRecord feed : repository.findActiveFeeds()) {
            feeds.putIfAbsent(feed.id(), feed);
        }

        Instant startedAt = clock.instant();
        long jobId = repository.startJob(startedAt);
        log.info("Ingestion job {} started with {} feed(s)", jobId, feeds.size());

        try {
            return runJob(jobId, startedAt, new ArrayList<>(feeds.values()), cancelSignal);
        } catch (RuntimeException e) {
            log.warn("Ingestion job {} failed", jobId, e);
            failJob(jobId, e);
            throw e;
        }
    }

    private IngestionJob runJob(long jobId, Instant startedAt, List<FeedRecord> targets, BooleanSupplier cancelSignal) {
        List<CompletableFuture<FeedOutcome>> futures = new ArrayList<>(targets.size());
        for (FeedRecord feed : targets) {
            futures.add(CompletableFuture.supplyAsync(() -> processFeed(jobId, feed, cancelSignal), ingestExecutor));
        }

        List<FeedOutcome> outcomes = new ArrayList<>(targets.size());
        for (int i = 0; i < futures.size(); i++) {
            FeedRecord feed = targets.get(i);
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Feed task for {} did not complete", feed.url(), e.getCause());
                FeedOutcome outcome = FeedOutcome.failed(feed, 0, 0, 0, ReasonCodeClassifier.UNKNOWN,
                    describe(e.getCause()), clock.instant());
                appendOutcome(jobId, outcome);
                outcomes.add(outcome);
            }
        }

        JobTotals totals = JobTotals.sum(outcomes);
        JobStatus status = resolveStatus(outcomes);
        String notes = "feeds=" + targets.size()
            + " new=" + totals.newCount()
            + " duplicate=" + totals.duplicateCount()
            + " failed=" + totals.failedCount();
        Instant finishedAt = clock.instant();
        repository.finalizeJob(jobId, finishedAt, status, notes, totals);
        log.info(
            "Ingestion job {} finished {}: feedsProcessed={} feedsFailed={} new={} duplicate={} failed={}",
            jobId,
            status,
            totals.feedsProcessed(),
            totals.feedsFailed(),
            totals.newCount(),
            totals.duplicateCount(),
            totals.failedCount()
        );
        return new IngestionJob(jobId, startedAt, finishedAt, status, notes, totals, List.copyOf(outcomes));
    }

    private void failJob(long jobId, RuntimeException cause) {
        try {
            repository.finalizeJob(jobId, clock.instant(), JobStatus.FAILED, "exception=" + cause.getClass().getSimpleName(),
                JobTotals.sum(repository.findJobOutcomes(jobId)));
        } catch (RuntimeException e) {
            log.warn("Unable to mark ingestion job {} as failed: {}", jobId, e.getMessage());
        }
    }

    private FeedOutcome processFeed(long jobId, FeedRecord feed, BooleanSupplier cancelled) {
        FeedOutcome outcome;
        if (cancelled.getAsBoolean()) {
            outcome = FeedOutcome.cancelled(feed, clock.instant());
        } else if (!inFlightFeeds.add(feed.id())) {
            outcome = FeedOutcome.skipped(feed, IN_FLIGHT, clock.instant());
        } else {
            try {
                outcome = feedIngestionService.ingestFeed(feed);
            } catch (StorageUnavailableException e) {
                log.warn("Storage unavailable while ingesting feed {}", feed.url(), e);
                outcome = FeedOutcome.failed(feed, 0, 0, 0, ReasonCodeClassifier.STORAGE_UNAVAILABLE,
                    describe(e), clock.instant());
            } catch (RuntimeException e) {
                log.warn("Feed ingestion failed for {}", feed.url(), e);
                outcome = FeedOutcome.failed(feed, 0, 0, 0, ReasonCodeClassifier.UNKNOWN, describe(e), clock.instant());
            } finally {
                inFlightFeeds.remove(feed.id());
            }
        }
        appendOutcome(jobId, outcome);
        return outcome;
    }

    private void appendOutcome(long jobId, FeedOutcome outcome) {
        try {
            repository.appendJobOutcome(jobId, outcome);
        } catch (RuntimeException e) {
            log.warn("Unable to append outcome for feed {} to job {}: {}", outcome.feedId(), jobId, e.getMessage());
        }
    }

    static JobStatus resolveStatus(List<FeedOutcome> outcomes) {
        boolean cancelled = false;
        boolean failed = false;
        for (FeedOutcome outcome : outcomes) {
            if (outcome.status() == FeedOutcomeStatus.CANCELLED) {
                cancelled = true;
            } else if (outcome.status() == FeedOutcomeStatus.FAILED) {
                failed = true;
            }
        }
        if (cancelled) {
            return JobStatus.CANCELLED;
        }
        return failed ? JobStatus.COMPLETED_WITH_ERRORS : JobStatus.COMPLETED;
    }

    private String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
