package com.mangaku.scraper.scrape.extract;

import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.metrics.ScraperMetrics;
import com.mangaku.scraper.scrape.model.MangaDetail;
import com.mangaku.scraper.scrape.normalize.KeyValueBlockParser;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DetailPageExtractorTest {
    private static final String DETAIL_HTML =
        """
            <html><body>
              <div class="thumb"><img class="attachment- size- wp-post-image" src="https://cdn.mangaaku.com/cover.jpg"></div>
              <h1 class="entry-title">Solo Leveling</h1>
              <div class="rating"><div class="num">8.90</div></div>
              <div class="tsinfo bixbox">
                <div class="imptdt">Status <i>Ongoing</i></div>
                <div class="imptdt">Type <a href="#">Manhwa</a></div>
                <div class="imptdt">Author <i>Chugong</i></div>
                <div class="imptdt">Posted By <span>admin</span></div>
                <div class="imptdt">Posted On <time>March 5, 2019</time></div>
                <div class="imptdt">Updated On <time>January 2, 2024</time></div>
                <div class="imptdt">Views <span>3.5K</span></div>
              </div>
              <div class="wd-full"><span class="mgen"><a href="/g/action">Action</a> <a href="/g/fantasy">Fantasy</a></span></div>
              <div class="wd-full"><span class="mgen"><a href="/g/drama">Drama</a></span></div>
              <div class="entry-content entry-content-single" itemprop="description">
                <p>Ten years ago, the Gate appeared.</p>
                <script>window.ads = true;</script>
                <style>.x{color:red}</style>
              </div>
              <div id="chapterlist"><ul>
                <li><div class="eph-num"><a href="https://mangaaku.com/solo-leveling-chapter-3/">Latest</a></div></li>
                <li><div class="eph-num"><a href="https://mangaaku.com/solo-leveling-chapter-3/">Chapter 3</a></div></li>
                <li><div class="eph-num"><a href="https://mangaaku.com/solo-leveling-chapter-2/">Chapter 2</a></div></li>
                <li><div class="eph-num"><a href="https://mangaaku.com/solo-leveling-chapter-1/">Chapter 1</a></div></li>
              </ul></div>
            </body></html>
            """;

    private DetailPageExtractor extractor;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        extractor = new DetailPageExtractor(properties, new KeyValueBlockParser(properties, new ScraperMetrics()));
    }

    @Test
    void extractsFullRecord() {
        MangaDetail detail = extractor.extract(Jsoup.parse(DETAIL_HTML), "/solo-leveling/").orElseThrow();

        assertThat(detail.id()).isEqualTo("solo-leveling");
        assertThat(detail.title()).isEqualTo("Solo Leveling");
        assertThat(detail.image()).isEqualTo("https://cdn.mangaaku.com/cover.jpg");
        assertThat(detail.rating()).isEqualTo("8.90");
        assertThat(detail.synopsis()).isEqualTo("Ten years ago, the Gate appeared.");
        assertThat(detail.description()).isEqualTo(detail.synopsis());
        assertThat(detail.status()).isEqualTo("Ongoing");
        assertThat(detail.type()).isEqualTo("Manhwa");
        assertThat(detail.author()).isEqualTo("Chugong");
        assertThat(detail.year()).isEqualTo(2019);
        assertThat(detail.views()).isEqualTo(3_500L);
        assertThat(detail.genres()).containsExactly("Action", "Fantasy", "Drama");
    }

    @Test
    void dropsLatestShortcutFromChapterList() {
        MangaDetail detail = extractor.extract(Jsoup.parse(DETAIL_HTML), "solo-leveling").orElseThrow();

        assertThat(detail.chapterList()).containsExactly(
            "/solo-leveling-chapter-3/",
            "/solo-leveling-chapter-2/",
            "/solo-leveling-chapter-1/"
        );
        assertThat(detail.chapterCount()).isEqualTo(3);
    }

    @Test
    void keepsSingleChapterAnchor() {
        String html = """
            <h1 class="entry-title">Oneshot</h1>
            <div class="eph-num"><a href="https://mangaaku.com/oneshot-chapter-1/">Chapter 1</a></div>
            """;

        MangaDetail detail = extractor.extract(Jsoup.parse(html), "oneshot").orElseThrow();

        assertThat(detail.chapterList()).containsExactly("/oneshot-chapter-1/");
        assertThat(detail.chapterCount()).isEqualTo(1);
    }

    @Test
    void dropsLatestShortcutByPositionEvenWithoutHref() {
        String html = """
            <h1 class="entry-title">Tower</h1>
            <div class="eph-num"><a>Latest</a></div>
            <div class="eph-num"><a href="https://mangaaku.com/t-chapter-2/">Chapter 2</a></div>
            <div class="eph-num"><a href="https://mangaaku.com/t-chapter-1/">Chapter 1</a></div>
            """;

        MangaDetail detail = extractor.extract(Jsoup.parse(html), "tower").orElseThrow();

        assertThat(detail.chapterList()).containsExactly("/t-chapter-2/", "/t-chapter-1/");
        assertThat(detail.chapterCount()).isEqualTo(2);
    }

    @Test
    void fallsBackToDefaultsWhenOptionalFieldsAreMissing() {
        MangaDetail detail = extractor.extract(Jsoup.parse("<h1 class=\"entry-title\">Bare</h1>"), "bare").orElseThrow();

        assertThat(detail.status()).isEqualTo(FieldFallbacks.UNKNOWN);
        assertThat(detail.author()).isEqualTo(FieldFallbacks.UNKNOWN);
        assertThat(detail.type()).isEqualTo(FieldFallbacks.DEFAULT_TYPE);
        assertThat(detail.rating()).isEqualTo(FieldFallbacks.NO_RATING);
        assertThat(detail.image()).isEqualTo(FieldFallbacks.NO_IMAGE);
        assertThat(detail.year()).isEqualTo(2025);
        assertThat(detail.views()).isZero();
        assertThat(detail.synopsis()).isEmpty();
        assertThat(detail.genres()).isEmpty();
        assertThat(detail.chapterList()).isEmpty();
    }

    @Test
    void usesUpdatedOnWhenPostedOnHasNoYear() {
        String html = """
            <h1 class="entry-title">Dated</h1>
            <div class="tsinfo bixbox">Status Completed Updated On June 1, 2017</div>
            """;

        MangaDetail detail = extractor.extract(Jsoup.parse(html), "dated").orElseThrow();

        assertThat(detail.year()).isEqualTo(2017);
        assertThat(detail.status()).isEqualTo("Completed");
    }

    @Test
    void truncatesLongSynopsisIntoDescription() {
        String synopsis = "x".repeat(150);
        String html = "<h1 class=\"entry-title\">Long</h1>"
            + "<div class=\"entry-content entry-content-single\">" + synopsis + "</div>";

        MangaDetail detail = extractor.extract(Jsoup.parse(html), "long").orElseThrow();

        assertThat(detail.synopsis()).isEqualTo(synopsis);
        assertThat(detail.description()).isEqualTo("x".repeat(100) + "...");
    }

    @Test
    void missingTitleMeansNotFound() {
        Optional<MangaDetail> detail = extractor.extract(Jsoup.parse("<html><body><p>404</p></body></html>"), "gone");

        assertThat(detail).isEmpty();
    }
}
