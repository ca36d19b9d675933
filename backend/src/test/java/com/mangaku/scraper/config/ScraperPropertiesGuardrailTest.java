package com.mangaku.scraper.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void baseUrlDropsTrailingSlashes() {
        ScraperProperties properties = new ScraperProperties();
        properties.setBaseUrl("https://example.org//");
        assertEquals("https://example.org", properties.getBaseUrl());

        properties.setBaseUrl(" ");
        assertEquals("https://mangaaku.com", properties.getBaseUrl());
    }

    @Test
    void retriesPoolAndTimeoutsAreClamped() {
        ScraperProperties.Http http = new ScraperProperties().getHttp();
        http.setMaxRetries(-2);
        http.setPoolSize(0);
        http.setPoolMaxSize(0);
        http.setRequestTimeout(Duration.ZERO);
        http.setRetryBaseDelay(Duration.ofMillis(-5));

        assertEquals(0, http.getMaxRetries());
        assertEquals(1, http.getPoolSize());
        assertEquals(1, http.getPoolMaxSize());
        assertEquals(Duration.ofSeconds(120), http.getRequestTimeout());
        assertEquals(Duration.ZERO, http.getRetryBaseDelay());
    }

    @Test
    void defaultsMatchDocumentedValues() {
        ScraperProperties properties = new ScraperProperties();
        ScraperProperties.Http http = properties.getHttp();
        assertEquals(3, http.getMaxRetries());
        assertEquals(Duration.ofSeconds(30), http.getConnectTimeout());
        assertEquals(Duration.ofSeconds(60), http.getEscalatedConnectTimeout());
        assertEquals(Duration.ofSeconds(180), http.getEscalatedReadTimeout());
        assertEquals(20, http.getPoolSize());
        assertEquals(50, http.getPoolMaxSize());
        assertFalse(http.isTrustAllCertificates());
        assertEquals(3, properties.getAggregation().getMaxSources());
        assertEquals(2025, properties.getExtraction().getDefaultYear());
    }

    @Test
    void pageLimitIsClampedToConfiguredMaximum() {
        ScraperProperties.Paging paging = new ScraperProperties().getPaging();
        assertEquals(20, paging.clampLimit(null));
        assertEquals(20, paging.clampLimit(0));
        assertEquals(5, paging.clampLimit(5));
        assertEquals(100, paging.clampLimit(1000));
    }
}
