package com.mangaku.scraper.scrape.model;

public record PerformanceStats(
    long requestCount,
    long cacheHitCount,
    CacheInfo cacheInfo
) {
}
