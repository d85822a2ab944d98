package com.baleen.corpus.ingest.model;

public enum JobStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    CANCELLED,
    FAILED
}
