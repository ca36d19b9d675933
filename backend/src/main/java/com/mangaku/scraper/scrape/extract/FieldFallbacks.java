package com.mangaku.scraper.scrape.extract;

import org.jsoup.nodes.Element;

/**
 * Default values substituted when an optional field is missing from the markup, plus the
 * null-safe selectors the extraction rules read fields through.
 */
public final class FieldFallbacks {
    public static final String UNKNOWN = "Unknown";
    public static final String DEFAULT_TYPE = "Manga";
    public static final String NO_IMAGE = "";
    public static final String NO_RATING = "0";

    private FieldFallbacks() {
    }

    public static String orDefault(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    static String text(Element root, String cssQuery, String fallback) {
        if (root == null) {
            return fallback;
        }
        Element element = root.selectFirst(cssQuery);
        return element == null ? fallback : orDefault(element.text(), fallback);
    }

    static String imageSource(Element root, String cssQuery) {
        if (root == null) {
            return NO_IMAGE;
        }
        Element image = root.selectFirst(cssQuery);
        if (image == null) {
            return NO_IMAGE;
        }
        String src = orDefault(image.attr("src"), null);
        if (src == null) {
            src = orDefault(image.attr("data-src"), NO_IMAGE);
        }
        return src;
    }
}
