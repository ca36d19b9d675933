package com.mangaku.scraper.scrape.model;

public record CacheInfo(
    long size,
    long maximumSize,
    long hitCount,
    long missCount,
    long evictionCount
) {
}
