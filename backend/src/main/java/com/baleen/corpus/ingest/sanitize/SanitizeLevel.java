package com.baleen.corpus.ingest.sanitize;

import java.util.Locale;

public enum SanitizeLevel {
    /** Stored markup as-is. */
    RAW,
    /** Whitelisted markup only. */
    SAFE,
    /** Plain text, no markup. */
    TEXT;

    public static SanitizeLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return SAFE;
        }
        return SanitizeLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
