package com.mangaku.scraper.scrape.model;

import com.mangaku.scraper.config.ScraperProperties;

import java.time.Duration;

public record FetchRequest(
    String url,
    Duration timeout,
    int maxRetries
) {
    public FetchRequest {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        maxRetries = Math.max(0, maxRetries);
    }

    public static FetchRequest of(String url, ScraperProperties.Http http) {
        return new FetchRequest(url, http.getRequestTimeout(), http.getMaxRetries());
    }
}
