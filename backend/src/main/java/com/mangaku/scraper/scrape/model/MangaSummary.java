package com.mangaku.scraper.scrape.model;

public record MangaSummary(
    String id,
    String title,
    String image,
    int totalChapters,
    double rating
) {
}
