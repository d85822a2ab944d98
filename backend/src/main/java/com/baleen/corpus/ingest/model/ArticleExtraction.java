package com.baleen.corpus.ingest.model;

public record ArticleExtraction(
    String html,
    ExtractionStatus status,
    String canonicalUrl,
    String reason
) {
    public static ArticleExtraction full(String html, String canonicalUrl) {
        return new ArticleExtraction(html, ExtractionStatus.FULL, canonicalUrl, null);
    }

    public static ArticleExtraction degraded(String summary, String canonicalUrl, String reason) {
        return new ArticleExtraction(summary == null ? "" : summary, ExtractionStatus.DEGRADED_SUMMARY, canonicalUrl, reason);
    }

    public boolean isFull() {
        return status == ExtractionStatus.FULL;
    }
}
