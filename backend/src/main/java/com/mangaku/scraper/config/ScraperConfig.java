package com.mangaku.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mangaku.scraper.scrape.extract.DetailPageExtractor;
import com.mangaku.scraper.scrape.extract.ListingItemExtractor;
import com.mangaku.scraper.scrape.extract.ReaderPageExtractor;
import com.mangaku.scraper.scrape.http.ResilientHttpClient;
import com.mangaku.scraper.scrape.metrics.ScraperMetrics;
import com.mangaku.scraper.scrape.normalize.KeyValueBlockParser;
import com.mangaku.scraper.scrape.service.MangaScraperService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "scraperHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService scraperHttpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getHttp().getPoolSize());
        return Executors.newFixedThreadPool(size);
    }

    // "mangaku" is the legacy name of the engine; it resolves to the same instance.
    @Bean(name = {"mangaScraperService", "mangaku"})
    public MangaScraperService mangaScraperService(
        ScraperProperties properties,
        ResilientHttpClient httpClient,
        ListingItemExtractor listingItemExtractor,
        DetailPageExtractor detailPageExtractor,
        ReaderPageExtractor readerPageExtractor,
        KeyValueBlockParser keyValueBlockParser,
        ScraperMetrics metrics
    ) {
        return new MangaScraperService(
            properties,
            httpClient,
            listingItemExtractor,
            detailPageExtractor,
            readerPageExtractor,
            keyValueBlockParser,
            metrics
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
