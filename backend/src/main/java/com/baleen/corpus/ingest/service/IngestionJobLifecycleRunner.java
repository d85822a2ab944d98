package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Jobs left open by a previous process can never be finalized by it; close them as FAILED so the
 * job ledger only ever shows one running job.
 */
@Component
public class IngestionJobLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionJobLifecycleRunner.class);

    private final IngestJdbcRepository repository;
    private final Clock clock;

    public IngestionJobLifecycleRunner(IngestJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!repository.isDbReachable()) {
            log.warn("Skipping ingestion job cleanup because database is unreachable");
            return;
        }
        List<Long> unfinished = repository.findUnfinishedJobIds();
        for (Long jobId : unfinished) {
            try {
                repository.finalizeJob(
                    jobId,
                    clock.instant(),
                    JobStatus.FAILED,
                    "aborted_on_startup",
                    JobTotals.sum(repository.findJobOutcomes(jobId))
                );
                log.info("Aborted ingestion job {} left running by a previous process", jobId);
            } catch (IllegalStateException e) {
                log.warn("Unable to abort ingestion job {}: {}", jobId, e.getMessage());
            }
        }
    }
}
