package com.mangaku.scraper.scrape.model;

import java.util.List;

public record MangaDetail(
    String id,
    String title,
    String image,
    String description,
    String synopsis,
    String type,
    String status,
    int year,
    List<String> genres,
    int chapterCount,
    List<String> chapterList,
    String author,
    String rating,
    long views
) {
    public MangaDetail {
        genres = genres == null ? List.of() : List.copyOf(genres);
        chapterList = chapterList == null ? List.of() : List.copyOf(chapterList);
    }
}
