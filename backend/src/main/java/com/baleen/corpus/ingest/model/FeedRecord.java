package com.baleen.corpus.ingest.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record FeedRecord(
    long id,
    String url,
    String title,
    String htmlUrl,
    Set<String> categories,
    String etag,
    String lastModified,
    Instant lastFetchedAt,
    FeedStatus status,
    int consecutiveErrors,
    String lastError,
    Map<String, String> extensions,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isActive() {
        return status != FeedStatus.INACTIVE;
    }

    public String primaryCategory() {
        if (categories == null || categories.isEmpty()) {
            return "uncategorized";
        }
        return categories.stream().sorted().findFirst().orElse("uncategorized");
    }
}
