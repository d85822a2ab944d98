package com.baleen.corpus.ingest.model;

import java.time.Instant;
import java.util.Map;

public record ExportSummary(
    String root,
    String format,
    String level,
    int feedsCount,
    int postsExported,
    Map<String, Integer> countsByCategory,
    Instant exportedAt
) {
}
