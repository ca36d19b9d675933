package com.mangaku.scraper.scrape.model;

public class UpstreamFetchException extends ScrapeException {
    private final transient FetchResult fetchResult;

    public UpstreamFetchException(String message, FetchResult fetchResult) {
        super(message, fetchResult == null ? null : fetchResult.requestedUrl(), suspectedCause(fetchResult));
        this.fetchResult = fetchResult;
    }

    public FetchResult getFetchResult() {
        return fetchResult;
    }

    private static String suspectedCause(FetchResult result) {
        if (result == null) {
            return null;
        }
        if (result.failureKind() != null) {
            return result.failureKind().name();
        }
        return "HTTP_" + result.statusCode();
    }
}
