package com.baleen.corpus.ingest.model;

import java.time.Instant;
import java.time.OffsetDateTime;

public record PostRecord(
    long id,
    long feedId,
    String url,
    String title,
    OffsetDateTime publishedAt,
    String content,
    ExtractionStatus extractionStatus,
    String fingerprint,
    String guid,
    Instant createdAt,
    Instant updatedAt
) {
}
