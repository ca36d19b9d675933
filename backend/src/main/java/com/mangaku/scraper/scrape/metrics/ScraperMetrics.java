package com.mangaku.scraper.scrape.metrics;

import com.mangaku.scraper.scrape.model.CacheInfo;
import com.mangaku.scraper.scrape.model.PerformanceStats;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters for upstream requests and key/value cache hits.
 */
@Component
public class ScraperMetrics {
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong cacheHitCount = new AtomicLong();

    public long recordRequest() {
        return requestCount.incrementAndGet();
    }

    public long recordCacheHit() {
        return cacheHitCount.incrementAndGet();
    }

    public long requestCount() {
        return requestCount.get();
    }

    public long cacheHitCount() {
        return cacheHitCount.get();
    }

    public PerformanceStats snapshot(CacheInfo cacheInfo) {
        return new PerformanceStats(requestCount.get(), cacheHitCount.get(), cacheInfo);
    }
}
