package com.baleen.corpus.ingest.model;

import java.time.Instant;

/**
 * Result of a conditional feed fetch.
 */
public record FetchOutcome(
    Kind kind,
    byte[] body,
    String finalUrl,
    String etag,
    String lastModified,
    Instant fetchedAt,
    String reasonCode,
    String message,
    boolean permanent
) {
    public enum Kind {
        MODIFIED,
        NOT_MODIFIED,
        FAILED
    }

    public static FetchOutcome modified(byte[] body, String finalUrl, String etag, String lastModified, Instant fetchedAt) {
        return new FetchOutcome(Kind.MODIFIED, body, finalUrl, etag, lastModified, fetchedAt, null, null, false);
    }

    public static FetchOutcome notModified(String etag, String lastModified, Instant fetchedAt) {
        return new FetchOutcome(Kind.NOT_MODIFIED, null, null, etag, lastModified, fetchedAt, null, null, false);
    }

    public static FetchOutcome failed(String reasonCode, String message, boolean permanent, Instant fetchedAt) {
        return new FetchOutcome(Kind.FAILED, null, null, null, null, fetchedAt, reasonCode, message, permanent);
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
