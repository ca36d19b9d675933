package com.mangaku.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";
    private static final String DEFAULT_BASE_URL = "https://mangaaku.com";

    private String baseUrl = DEFAULT_BASE_URL;
    private String userAgent;
    private Http http = new Http();
    private Aggregation aggregation = new Aggregation();
    private Cache cache = new Cache();
    private Extraction extraction = new Extraction();
    private Paging paging = new Paging();
    private Cli cli = new Cli();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            this.baseUrl = DEFAULT_BASE_URL;
            return;
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Paging getPaging() {
        return paging;
    }

    public void setPaging(Paging paging) {
        this.paging = paging;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static Duration positiveOr(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isNegative() || candidate.isZero()) {
            return fallback;
        }
        return candidate;
    }

    public static class Http {
        private int maxRetries = 3;
        private Duration requestTimeout = Duration.ofSeconds(120);
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration escalatedConnectTimeout = Duration.ofSeconds(60);
        private Duration escalatedReadTimeout = Duration.ofSeconds(180);
        private Duration retryBaseDelay = Duration.ofMillis(500);
        private Duration retryMaxDelay = Duration.ofSeconds(8);
        private int poolSize = 20;
        private int poolMaxSize = 50;
        private boolean trustAllCertificates;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = positiveOr(requestTimeout, Duration.ofSeconds(120));
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(30));
        }

        public Duration getEscalatedConnectTimeout() {
            return escalatedConnectTimeout;
        }

        public void setEscalatedConnectTimeout(Duration escalatedConnectTimeout) {
            this.escalatedConnectTimeout = positiveOr(escalatedConnectTimeout, Duration.ofSeconds(60));
        }

        public Duration getEscalatedReadTimeout() {
            return escalatedReadTimeout;
        }

        public void setEscalatedReadTimeout(Duration escalatedReadTimeout) {
            this.escalatedReadTimeout = positiveOr(escalatedReadTimeout, Duration.ofSeconds(180));
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay == null || retryBaseDelay.isNegative()
                ? Duration.ZERO
                : retryBaseDelay;
        }

        public Duration getRetryMaxDelay() {
            return retryMaxDelay;
        }

        public void setRetryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay == null || retryMaxDelay.isNegative()
                ? Duration.ZERO
                : retryMaxDelay;
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }

        public int getPoolMaxSize() {
            return Math.max(getPoolSize(), poolMaxSize);
        }

        public void setPoolMaxSize(int poolMaxSize) {
            this.poolMaxSize = Math.max(1, poolMaxSize);
        }

        public boolean isTrustAllCertificates() {
            return trustAllCertificates;
        }

        public void setTrustAllCertificates(boolean trustAllCertificates) {
            this.trustAllCertificates = trustAllCertificates;
        }
    }

    public static class Aggregation {
        private int maxSources = 3;
        private Duration taskTimeout = Duration.ofSeconds(10);
        private Duration overallTimeout = Duration.ofSeconds(30);

        public int getMaxSources() {
            return maxSources;
        }

        public void setMaxSources(int maxSources) {
            this.maxSources = Math.max(1, maxSources);
        }

        public Duration getTaskTimeout() {
            return taskTimeout;
        }

        public void setTaskTimeout(Duration taskTimeout) {
            this.taskTimeout = positiveOr(taskTimeout, Duration.ofSeconds(10));
        }

        public Duration getOverallTimeout() {
            return overallTimeout;
        }

        public void setOverallTimeout(Duration overallTimeout) {
            this.overallTimeout = positiveOr(overallTimeout, Duration.ofSeconds(30));
        }
    }

    public static class Cache {
        private long keyValueMaxEntries = 1024;

        public long getKeyValueMaxEntries() {
            return keyValueMaxEntries;
        }

        public void setKeyValueMaxEntries(long keyValueMaxEntries) {
            this.keyValueMaxEntries = Math.max(1, keyValueMaxEntries);
        }
    }

    public static class Extraction {
        private int defaultYear = 2025;
        private int descriptionMaxLength = 100;

        public int getDefaultYear() {
            return defaultYear;
        }

        public void setDefaultYear(int defaultYear) {
            this.defaultYear = defaultYear;
        }

        public int getDescriptionMaxLength() {
            return descriptionMaxLength;
        }

        public void setDescriptionMaxLength(int descriptionMaxLength) {
            this.descriptionMaxLength = Math.max(1, descriptionMaxLength);
        }
    }

    public static class Paging {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }

        public int getMaxPageSize() {
            return Math.max(getDefaultPageSize(), maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = Math.max(1, maxPageSize);
        }

        public int clampLimit(Integer requested) {
            if (requested == null || requested <= 0) {
                return getDefaultPageSize();
            }
            return Math.min(requested, getMaxPageSize());
        }
    }

    public static class Cli {
        private boolean run;
        private String command = "list";
        private String argument = "";
        private int page = 1;
        private int limit = 20;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getArgument() {
            return argument;
        }

        public void setArgument(String argument) {
            this.argument = argument == null ? "" : argument;
        }

        public int getPage() {
            return page;
        }

        public void setPage(int page) {
            this.page = Math.max(1, page);
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
