package com.mangaku.scraper.scrape.model;

/**
 * Base failure raised by the scraper engine. Carries the upstream URL that was being
 * read and, when known, a short machine-oriented hint about the cause.
 */
public class ScrapeException extends RuntimeException {
    private final String upstreamUrl;
    private final String suspectedCause;

    public ScrapeException(String message, String upstreamUrl, String suspectedCause) {
        super(message);
        this.upstreamUrl = upstreamUrl;
        this.suspectedCause = suspectedCause;
    }

    public ScrapeException(String message, String upstreamUrl, String suspectedCause, Throwable cause) {
        super(message, cause);
        this.upstreamUrl = upstreamUrl;
        this.suspectedCause = suspectedCause;
    }

    public String getUpstreamUrl() {
        return upstreamUrl;
    }

    public String getSuspectedCause() {
        return suspectedCause;
    }
}
