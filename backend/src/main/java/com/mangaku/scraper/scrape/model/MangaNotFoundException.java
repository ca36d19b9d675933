package com.mangaku.scraper.scrape.model;

public class MangaNotFoundException extends ScrapeException {
    public MangaNotFoundException(String message, String upstreamUrl, String suspectedCause) {
        super(message, upstreamUrl, suspectedCause);
    }
}
