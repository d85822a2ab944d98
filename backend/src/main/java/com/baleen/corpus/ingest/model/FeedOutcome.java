package com.baleen.corpus.ingest.model;

import java.time.Instant;

public record FeedOutcome(
    long feedId,
    String feedUrl,
    int newCount,
    int duplicateCount,
    int failedCount,
    FeedOutcomeStatus status,
    String reasonCode,
    String message,
    Instant completedAt
) {
    public static FeedOutcome failed(FeedRecord feed, int newCount, int duplicateCount, int failedCount,
                                     String reasonCode, String message, Instant completedAt) {
        return new FeedOutcome(feed.id(), feed.url(), newCount, duplicateCount, failedCount,
            FeedOutcomeStatus.FAILED, reasonCode, message, completedAt);
    }

    public static FeedOutcome cancelled(FeedRecord feed, Instant completedAt) {
        return new FeedOutcome(feed.id(), feed.url(), 0, 0, 0, FeedOutcomeStatus.CANCELLED, null,
            "tick cancelled before feed started", completedAt);
    }

    public static FeedOutcome skipped(FeedRecord feed, String reasonCode, Instant completedAt) {
        return new FeedOutcome(feed.id(), feed.url(), 0, 0, 0, FeedOutcomeStatus.SKIPPED, reasonCode, null, completedAt);
    }
}
