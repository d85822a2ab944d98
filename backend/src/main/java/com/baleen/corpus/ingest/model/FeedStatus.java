package com.baleen.corpus.ingest.model;

import java.util.Locale;

public enum FeedStatus {
    ACTIVE,
    ERROR,
    INACTIVE;

    public static FeedStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        return FeedStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
