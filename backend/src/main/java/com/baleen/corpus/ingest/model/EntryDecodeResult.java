package com.baleen.corpus.ingest.model;

/**
 * Outcome of decoding one feed entry: either a parsed entry or the reason it was skipped.
 */
public record EntryDecodeResult(FeedEntry entry, String skipReason) {

    public static EntryDecodeResult parsed(FeedEntry entry) {
        return new EntryDecodeResult(entry, null);
    }

    public static EntryDecodeResult skipped(String reason) {
        return new EntryDecodeResult(null, reason == null ? "unknown" : reason);
    }

    public boolean isParsed() {
        return entry != null;
    }
}
