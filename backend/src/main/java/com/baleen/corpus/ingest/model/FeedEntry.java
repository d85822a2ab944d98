package com.baleen.corpus.ingest.model;

import java.time.OffsetDateTime;

public record FeedEntry(
    String title,
    String link,
    String summary,
    OffsetDateTime publishedAt,
    String guid
) {
    /**
     * Entity identity: the guid when the feed provides one, otherwise the link.
     */
    public String identity() {
        if (guid != null && !guid.isBlank()) {
            return guid.trim();
        }
        return link;
    }

    public boolean hasGuid() {
        return guid != null && !guid.isBlank();
    }
}
