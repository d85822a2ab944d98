package com.baleen.corpus.ingest.model;

import java.time.Instant;
import java.util.List;

public record IngestionJob(
    long id,
    Instant startedAt,
    Instant finishedAt,
    JobStatus status,
    String notes,
    JobTotals totals,
    List<FeedOutcome> outcomes
) {
}
