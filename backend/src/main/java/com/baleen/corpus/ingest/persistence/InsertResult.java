package com.baleen.corpus.ingest.persistence;

public enum InsertResult {
    INSERTED,
    ALREADY_EXISTS
}
