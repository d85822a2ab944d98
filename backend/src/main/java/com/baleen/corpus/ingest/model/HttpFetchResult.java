package com.baleen.corpus.ingest.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    String etag,
    String lastModified,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNotModified() {
        return statusCode == 304 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public HttpFetchResult withAttempts(int attemptCount) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            bodyBytes,
            contentType,
            contentEncoding,
            etag,
            lastModified,
            fetchedAt,
            duration,
            attemptCount,
            errorCode,
            errorMessage
        );
    }
}
