package com.baleen.corpus.ingest.service;

import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.StatusResponse;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class IngestStatusService {
    private static final Logger log = LoggerFactory.getLogger(IngestStatusService.class);
    private static final int DEFAULT_JOB_LIMIT = 50;

    private final IngestJdbcRepository repository;
    private final IngestionSchedulerService schedulerService;

    public IngestStatusService(IngestJdbcRepository repository, IngestionSchedulerService schedulerService) {
        this.repository = repository;
        this.schedulerService = schedulerService;
    }

    public StatusResponse getStatus() {
        boolean dbConnectivity = repository.isDbReachable();
        Map<String, Long> counts = Map.of();
        IngestionJob mostRecent = null;
        if (dbConnectivity) {
            try {
                counts = repository.tableCounts();
                mostRecent = repository.findMostRecentJob();
            } catch (RuntimeException e) {
                log.warn("Failed to load ingestion status counts", e);
            }
        }
        return new StatusResponse(dbConnectivity, counts, mostRecent, schedulerService.getStatus());
    }

    public List<FeedRecord> listFeeds(FeedStatus status, String category) {
        return repository.findFeeds(status, category);
    }

    public List<IngestionJob> listJobs(Instant from, Instant to, JobStatus status, Long feedId, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_JOB_LIMIT : limit;
        return repository.findJobs(from, to, status, feedId, effectiveLimit);
    }

    public IngestionJob getJob(long jobId) {
        return repository.findJob(jobId);
    }
}
