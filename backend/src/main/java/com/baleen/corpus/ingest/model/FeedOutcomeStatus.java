package com.baleen.corpus.ingest.model;

public enum FeedOutcomeStatus {
    SUCCEEDED,
    NOT_MODIFIED,
    FAILED,
    CANCELLED,
    SKIPPED
}
