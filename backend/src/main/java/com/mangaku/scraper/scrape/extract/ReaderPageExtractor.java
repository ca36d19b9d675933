package com.mangaku.scraper.scrape.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.mangaku.scraper.scrape.aggregate.MirrorImageAggregator;
import com.mangaku.scraper.scrape.model.ChapterReadResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ReaderPageExtractor {
    private final ReaderPayloadParser payloadParser;
    private final MirrorImageAggregator aggregator;

    public ReaderPageExtractor(ReaderPayloadParser payloadParser, MirrorImageAggregator aggregator) {
        this.payloadParser = payloadParser;
        this.aggregator = aggregator;
    }

    public Optional<ChapterReadResult> extract(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        String title = FieldFallbacks.text(document, "h1.entry-title", null);
        if (title == null) {
            return Optional.empty();
        }
        List<JsonNode> sources = payloadParser.parseSources(html);
        return Optional.of(new ChapterReadResult(title, aggregator.aggregate(sources)));
    }
}
