package com.baleen.corpus.ingest.model;

import java.time.OffsetDateTime;

public record PostDraft(
    long feedId,
    String url,
    String title,
    OffsetDateTime publishedAt,
    String content,
    ExtractionStatus extractionStatus,
    String fingerprint,
    String guid
) {
}
