package com.baleen.corpus.ingest.model;

import com.baleen.corpus.ingest.parse.FeedFormat;

import java.util.List;

public record ParsedFeed(
    FeedFormat format,
    String title,
    List<EntryDecodeResult> results
) {
    public List<FeedEntry> entries() {
        return results.stream()
            .filter(EntryDecodeResult::isParsed)
            .map(EntryDecodeResult::entry)
            .toList();
    }

    public int skippedCount() {
        return (int) results.stream().filter(result -> !result.isParsed()).count();
    }
}
