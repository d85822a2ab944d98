package com.baleen.corpus.ingest.model;

import java.time.Instant;

public record SchedulerStatus(
    SchedulerState state,
    boolean timerActive,
    Long intervalSeconds,
    Instant lastTickStartedAt,
    Instant lastTickFinishedAt,
    Long lastJobId,
    long skippedTicks
) {
}
