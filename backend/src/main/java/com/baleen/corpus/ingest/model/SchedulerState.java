package com.baleen.corpus.ingest.model;

public enum SchedulerState {
    IDLE,
    RUNNING,
    CANCELLING
}
