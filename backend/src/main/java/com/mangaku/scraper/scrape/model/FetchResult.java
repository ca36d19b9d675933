package com.mangaku.scraper.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record FetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    FetchFailureKind failureKind,
    String errorMessage,
    int attempts
) {
    public static FetchResult failure(
        String url,
        Instant startedAt,
        FetchFailureKind kind,
        String message,
        int attempts
    ) {
        Instant now = Instant.now();
        return new FetchResult(url, 0, null, null, null, now, Duration.between(startedAt, now), kind, message, attempts);
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    public boolean isSuccessful() {
        return failureKind == null && statusCode >= 200 && statusCode < 300;
    }

    public FetchResult withAttempts(int totalAttempts) {
        return new FetchResult(
            requestedUrl,
            statusCode,
            body,
            bodyBytes,
            contentType,
            fetchedAt,
            duration,
            failureKind,
            errorMessage,
            totalAttempts
        );
    }
}
