package com.mangaku.scraper.scrape.model;

public enum FetchFailureKind {
    CONNECT_TIMEOUT,
    READ_TIMEOUT,
    TRANSPORT_ERROR,
    INVALID_URL,
    INTERRUPTED
}
