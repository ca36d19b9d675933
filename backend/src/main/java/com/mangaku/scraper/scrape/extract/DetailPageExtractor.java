package com.mangaku.scraper.scrape.extract;

import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.model.MangaDetail;
import com.mangaku.scraper.scrape.normalize.FieldNormalizers;
import com.mangaku.scraper.scrape.normalize.KeyValueBlockParser;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class DetailPageExtractor {
    private final ScraperProperties properties;
    private final KeyValueBlockParser keyValueBlockParser;

    public DetailPageExtractor(ScraperProperties properties, KeyValueBlockParser keyValueBlockParser) {
        this.properties = properties;
        this.keyValueBlockParser = keyValueBlockParser;
    }

    /**
     * Returns empty when the page has no {@code h1.entry-title}; every other field falls back
     * to its default.
     */
    public Optional<MangaDetail> extract(Document document, String slug) {
        if (document == null) {
            return Optional.empty();
        }
        String title = FieldFallbacks.text(document, "h1.entry-title", null);
        if (title == null) {
            return Optional.empty();
        }

        String image = FieldFallbacks.imageSource(document, "img.wp-post-image");
        if (image.isEmpty()) {
            image = FieldFallbacks.imageSource(document, "div.thumb img");
        }
        String rating = FieldFallbacks.text(document, "div.num", FieldFallbacks.NO_RATING);
        String synopsis = synopsis(document);
        List<String> chapters = chapterList(document);

        Map<String, String> info = keyValueBlockParser.parse(infoBlock(document));
        int year = FieldNormalizers.year(
            properties.getExtraction().getDefaultYear(),
            info.get(KeyValueBlockParser.POSTED_ON),
            info.get(KeyValueBlockParser.UPDATED_ON)
        );

        return Optional.of(new MangaDetail(
            SiteUrls.stripSlashes(slug),
            title,
            image,
            FieldNormalizers.truncate(synopsis, properties.getExtraction().getDescriptionMaxLength()),
            synopsis,
            FieldFallbacks.orDefault(info.get(KeyValueBlockParser.TYPE), FieldFallbacks.DEFAULT_TYPE),
            FieldFallbacks.orDefault(info.get(KeyValueBlockParser.STATUS), FieldFallbacks.UNKNOWN),
            year,
            genres(document),
            chapters.size(),
            chapters,
            FieldFallbacks.orDefault(info.get(KeyValueBlockParser.AUTHOR), FieldFallbacks.UNKNOWN),
            rating,
            FieldNormalizers.views(info.get(KeyValueBlockParser.VIEWS))
        ));
    }

    List<String> genres(Document document) {
        List<String> genres = new ArrayList<>();
        for (Element genreNode : document.select("span.mgen")) {
            Elements links = genreNode.select("a");
            if (links.isEmpty()) {
                addIfPresent(genres, genreNode.text());
                continue;
            }
            for (Element link : links) {
                addIfPresent(genres, link.text());
            }
        }
        return genres;
    }

    String synopsis(Document document) {
        Element block = document.selectFirst("div.entry-content.entry-content-single");
        if (block == null) {
            return "";
        }
        Element copy = block.clone();
        copy.select("script, style").remove();
        return copy.text().trim();
    }

    // The first eph-num node is the "latest chapter" shortcut, not a chapter of its own.
    List<String> chapterList(Document document) {
        Elements nodes = document.select("div.eph-num");
        int first = nodes.size() > 1 ? 1 : 0;
        List<String> chapters = new ArrayList<>();
        for (int i = first; i < nodes.size(); i++) {
            Element link = nodes.get(i).selectFirst("a[href]");
            if (link == null) {
                continue;
            }
            String path = SiteUrls.relativePath(link.attr("href"), properties.getBaseUrl());
            if (!path.isEmpty()) {
                chapters.add(path);
            }
        }
        return chapters;
    }

    private String infoBlock(Document document) {
        Element block = document.selectFirst("div.tsinfo.bixbox");
        return block == null ? "" : FieldNormalizers.collapseWhitespace(block.text());
    }

    private static void addIfPresent(List<String> values, String candidate) {
        if (candidate != null && !candidate.isBlank()) {
            values.add(candidate.trim());
        }
    }
}
