package com.baleen.corpus.ingest.model;

public enum ExtractionStatus {
    FULL,
    DEGRADED_SUMMARY
}
