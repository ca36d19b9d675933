package com.mangaku.scraper.scrape.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.model.ScrapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final MangaScraperService scraperService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        MangaScraperService scraperService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scraperService = scraperService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScraperProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            Object result = execute(cli);
            log.info("{} result:\n{}", cli.getCommand(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            log.info("Stats: {}", scraperService.performanceStats());
        } catch (ScrapeException e) {
            exitCode = 2;
            log.error(
                "{} failed: {} (url={}, cause={})",
                cli.getCommand(),
                e.getMessage(),
                e.getUpstreamUrl(),
                e.getSuspectedCause(),
                e
            );
        } catch (IllegalArgumentException | JsonProcessingException e) {
            exitCode = 1;
            log.error("{} failed: {}", cli.getCommand(), e.getMessage(), e);
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }

    Object execute(ScraperProperties.Cli cli) {
        String command = cli.getCommand() == null ? "" : cli.getCommand().trim().toLowerCase(Locale.ROOT);
        return switch (command) {
            case "list" -> scraperService.listManga(cli.getPage(), cli.getLimit());
            case "search" -> scraperService.searchManga(cli.getArgument(), cli.getPage(), cli.getLimit());
            case "detail" -> scraperService.getMangaDetail(cli.getArgument());
            case "read" -> scraperService.readChapter(cli.getArgument());
            case "stats" -> scraperService.performanceStats();
            default -> throw new IllegalArgumentException("Unknown command: " + cli.getCommand());
        };
    }
}
