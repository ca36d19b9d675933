package com.mangaku.scraper.scrape.normalize;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.metrics.ScraperMetrics;
import com.mangaku.scraper.scrape.model.CacheInfo;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a flattened info block ("Status Ongoing Type Manhwa Author ...") into labelled values.
 * Results are memoized by the exact block text in a size-bounded cache.
 */
@Component
public class KeyValueBlockParser {
    public static final String STATUS = "status";
    public static final String TYPE = "type";
    public static final String AUTHOR = "author";
    public static final String POSTED_BY = "posted_by";
    public static final String POSTED_ON = "posted_on";
    public static final String UPDATED_ON = "updated_on";
    public static final String VIEWS = "views";

    private static final String DATE = "([A-Za-z]+\\s+\\d{1,2},\\s+\\d{4})";
    private static final Map<String, Pattern> PATTERNS = patterns();

    private final Cache<String, Map<String, String>> cache;
    private final long maximumSize;
    private final ScraperMetrics metrics;

    public KeyValueBlockParser(ScraperProperties properties, ScraperMetrics metrics) {
        this.maximumSize = properties.getCache().getKeyValueMaxEntries();
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .executor(Runnable::run)
            .recordStats()
            .build();
    }

    public Map<String, String> parse(String blockText) {
        if (blockText == null || blockText.isBlank()) {
            return Map.of();
        }
        Map<String, String> cached = cache.getIfPresent(blockText);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        Map<String, String> parsed = doParse(blockText);
        cache.put(blockText, parsed);
        return parsed;
    }

    public CacheInfo cacheInfo() {
        CacheStats stats = cache.stats();
        return new CacheInfo(
            cache.estimatedSize(),
            maximumSize,
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount()
        );
    }

    void cleanUp() {
        cache.cleanUp();
    }

    private static Map<String, String> doParse(String blockText) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(blockText);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                if (!value.isEmpty()) {
                    result.put(entry.getKey(), value);
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Pattern> patterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(STATUS, Pattern.compile("Status\\s+(\\w+)"));
        patterns.put(TYPE, Pattern.compile("Type\\s+(\\w+)"));
        patterns.put(AUTHOR, Pattern.compile("Author\\s+(?!Posted By)(.+?)\\s*(?=Posted By|Posted On|Updated On|Views|$)"));
        patterns.put(POSTED_BY, Pattern.compile("Posted By\\s+(\\w+)"));
        patterns.put(POSTED_ON, Pattern.compile("Posted On\\s+" + DATE));
        patterns.put(UPDATED_ON, Pattern.compile("Updated On\\s+" + DATE));
        patterns.put(VIEWS, Pattern.compile("Views\\s+(\\S+)"));
        return Collections.unmodifiableMap(patterns);
    }
}
