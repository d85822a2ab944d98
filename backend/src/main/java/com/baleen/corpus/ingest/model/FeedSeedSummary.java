package com.baleen.corpus.ingest.model;

import java.util.List;

public record FeedSeedSummary(
    int feedsUpserted,
    int errorsCount,
    List<String> sampleErrors
) {
}
