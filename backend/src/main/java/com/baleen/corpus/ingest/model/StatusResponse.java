package com.baleen.corpus.ingest.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    IngestionJob mostRecentJob,
    SchedulerStatus scheduler
) {
}
