package com.baleen.corpus.ingest.model;

public record ReextractionSummary(
    int attempted,
    int upgraded,
    int stillDegraded
) {
}
