package com.mangaku.scraper.scrape.extract;

import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.model.MangaSummary;
import com.mangaku.scraper.scrape.normalize.FieldNormalizers;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads catalog entries ({@code div.bsx}) from listing and search result pages.
 */
@Component
public class ListingItemExtractor {
    private static final Logger log = LoggerFactory.getLogger(ListingItemExtractor.class);
    static final String ENTRY_SELECTOR = "div.bsx";

    private final ScraperProperties properties;

    public ListingItemExtractor(ScraperProperties properties) {
        this.properties = properties;
    }

    public List<MangaSummary> extract(Document document, int limit) {
        if (document == null || limit <= 0) {
            return List.of();
        }
        List<MangaSummary> summaries = new ArrayList<>();
        int position = 0;
        for (Element entry : document.select(ENTRY_SELECTOR)) {
            if (summaries.size() >= limit) {
                break;
            }
            position++;
            try {
                Optional<MangaSummary> summary = extractItem(entry);
                if (summary.isPresent()) {
                    summaries.add(summary.get());
                } else {
                    log.warn("Skipping listing entry #{}: missing link or title", position);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping malformed listing entry #{}", position, e);
            }
        }
        return summaries;
    }

    public Optional<MangaSummary> extractItem(Element entry) {
        Element link = entry.selectFirst("a[href]");
        if (link == null) {
            return Optional.empty();
        }
        String title = FieldFallbacks.orDefault(link.attr("title"), null);
        if (title == null) {
            title = FieldFallbacks.text(entry, ".tt", null);
        }
        String id = SiteUrls.slug(link.attr("href"), properties.getBaseUrl());
        if (title == null || id.isEmpty()) {
            return Optional.empty();
        }

        String image = FieldFallbacks.imageSource(entry, "img");
        String score = FieldFallbacks.text(entry, "div.numscore", FieldFallbacks.NO_RATING);
        String chapterText = FieldFallbacks.text(entry, "div.epxs", "");

        return Optional.of(new MangaSummary(
            id,
            title,
            image,
            FieldNormalizers.firstInt(chapterText),
            FieldNormalizers.rating(score)
        ));
    }
}
