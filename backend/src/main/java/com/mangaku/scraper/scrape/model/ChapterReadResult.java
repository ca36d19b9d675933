package com.mangaku.scraper.scrape.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ChapterReadResult(
    String title,
    Map<String, List<String>> servers
) {
    public ChapterReadResult {
        servers = servers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(servers));
    }
}
