package com.mangaku.scraper.scrape.extract;

final class SiteUrls {
    private static final String MANGA_PREFIX = "manga/";

    private SiteUrls() {
    }

    /**
     * Strips the origin from an absolute link, leaving the site-relative path
     * ({@code https://site/abc-chapter-1/} becomes {@code /abc-chapter-1/}).
     */
    static String relativePath(String href, String baseUrl) {
        if (href == null) {
            return "";
        }
        String value = href.trim();
        if (baseUrl != null && !baseUrl.isBlank()) {
            value = value.replace(baseUrl, "");
        }
        return value;
    }

    static String slug(String href, String baseUrl) {
        String value = stripSlashes(relativePath(href, baseUrl));
        if (value.startsWith(MANGA_PREFIX)) {
            value = stripSlashes(value.substring(MANGA_PREFIX.length()));
        }
        return value;
    }

    static String stripSlashes(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
