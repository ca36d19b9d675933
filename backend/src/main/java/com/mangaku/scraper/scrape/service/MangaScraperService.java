package com.mangaku.scraper.scrape.service;

import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.extract.DetailPageExtractor;
import com.mangaku.scraper.scrape.extract.ListingItemExtractor;
import com.mangaku.scraper.scrape.extract.ReaderPageExtractor;
import com.mangaku.scraper.scrape.http.ResilientHttpClient;
import com.mangaku.scraper.scrape.metrics.ScraperMetrics;
import com.mangaku.scraper.scrape.model.ChapterReadResult;
import com.mangaku.scraper.scrape.model.FetchResult;
import com.mangaku.scraper.scrape.model.MangaDetail;
import com.mangaku.scraper.scrape.model.MangaNotFoundException;
import com.mangaku.scraper.scrape.model.MangaSummary;
import com.mangaku.scraper.scrape.model.PerformanceStats;
import com.mangaku.scraper.scrape.model.UpstreamFetchException;
import com.mangaku.scraper.scrape.normalize.KeyValueBlockParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Entry point used by the outer API/CLI layers. One instance owns the transport, the
 * key/value cache and the counters for its whole lifetime; it is registered under both
 * {@code mangaScraperService} and the legacy {@code mangaku} bean name.
 */
public class MangaScraperService {
    private static final Logger log = LoggerFactory.getLogger(MangaScraperService.class);

    private final ScraperProperties properties;
    private final ResilientHttpClient httpClient;
    private final ListingItemExtractor listingItemExtractor;
    private final DetailPageExtractor detailPageExtractor;
    private final ReaderPageExtractor readerPageExtractor;
    private final KeyValueBlockParser keyValueBlockParser;
    private final ScraperMetrics metrics;

    public MangaScraperService(
        ScraperProperties properties,
        ResilientHttpClient httpClient,
        ListingItemExtractor listingItemExtractor,
        DetailPageExtractor detailPageExtractor,
        ReaderPageExtractor readerPageExtractor,
        KeyValueBlockParser keyValueBlockParser,
        ScraperMetrics metrics
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.listingItemExtractor = listingItemExtractor;
        this.detailPageExtractor = detailPageExtractor;
        this.readerPageExtractor = readerPageExtractor;
        this.keyValueBlockParser = keyValueBlockParser;
        this.metrics = metrics;
    }

    public List<MangaSummary> listManga(int page, Integer limit) {
        String url = properties.getBaseUrl() + "/manga/?page=" + Math.max(1, page) + "&order=update";
        Document document = Jsoup.parse(fetchHtml(url), url);
        List<MangaSummary> summaries = listingItemExtractor.extract(document, properties.getPaging().clampLimit(limit));
        log.info("Listed {} manga from page {}", summaries.size(), page);
        return summaries;
    }

    public List<MangaSummary> searchManga(String query, int page, Integer limit) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String url = properties.getBaseUrl() + "/page/" + Math.max(1, page) + "/?s="
            + URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
        Document document = Jsoup.parse(fetchHtml(url), url);
        List<MangaSummary> summaries = listingItemExtractor.extract(document, properties.getPaging().clampLimit(limit));
        log.info("Search '{}' page {} returned {} manga", query, page, summaries.size());
        return summaries;
    }

    public MangaDetail getMangaDetail(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be blank");
        }
        String url = properties.getBaseUrl() + "/manga/" + slug.trim();
        Document document = Jsoup.parse(fetchHtml(url), url);
        return detailPageExtractor.extract(document, slug)
            .orElseThrow(() -> new MangaNotFoundException("Manga detail page has no title", url, "missing_title"));
    }

    public ChapterReadResult readChapter(String readerPath) {
        if (readerPath == null || readerPath.isBlank()) {
            throw new IllegalArgumentException("reader path must not be blank");
        }
        String path = readerPath.trim();
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        String url = properties.getBaseUrl() + "/" + path;
        ChapterReadResult result = readerPageExtractor.extract(fetchHtml(url))
            .orElseThrow(() -> new MangaNotFoundException("Chapter page has no title", url, "missing_title"));
        log.info("Read chapter '{}' from {} server(s)", result.title(), result.servers().size());
        return result;
    }

    public PerformanceStats performanceStats() {
        return metrics.snapshot(keyValueBlockParser.cacheInfo());
    }

    private String fetchHtml(String url) {
        FetchResult result = httpClient.get(url);
        if (result.isFailure()) {
            log.error("Fetch of {} failed after {} attempt(s): {} {}", url, result.attempts(), result.failureKind(), result.errorMessage());
            throw new UpstreamFetchException("Upstream fetch failed: " + result.failureKind(), result);
        }
        if (result.statusCode() == 404) {
            throw new MangaNotFoundException("Upstream returned 404", url, "HTTP_404");
        }
        if (!result.isSuccessful()) {
            log.error("Fetch of {} returned status {} after {} attempt(s)", url, result.statusCode(), result.attempts());
            throw new UpstreamFetchException("Upstream returned status " + result.statusCode(), result);
        }
        return result.body() == null ? "" : result.body();
    }
}
