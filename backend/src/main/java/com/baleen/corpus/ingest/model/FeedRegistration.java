package com.baleen.corpus.ingest.model;

import java.util.Map;
import java.util.Set;

/**
 * Upstream description of a feed, created-or-updated by URL.
 */
public record FeedRegistration(
    String url,
    String title,
    String htmlUrl,
    Set<String> categories,
    Map<String, String> extensions
) {
    public FeedRegistration {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }
}
