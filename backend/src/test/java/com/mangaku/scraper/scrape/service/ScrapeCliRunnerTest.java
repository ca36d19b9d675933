package com.mangaku.scraper.scrape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.model.CacheInfo;
import com.mangaku.scraper.scrape.model.PerformanceStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeCliRunnerTest {

    @Mock
    private MangaScraperService scraperService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    private ScraperProperties properties;
    private ScrapeCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        runner = new ScrapeCliRunner(properties, scraperService, new ObjectMapper(), applicationContext);
    }

    @Test
    void doesNothingUnlessEnabled() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(scraperService);
    }

    @Test
    void dispatchesCommandsToTheEngine() {
        ScraperProperties.Cli cli = properties.getCli();
        cli.setCommand("search");
        cli.setArgument("solo");
        cli.setPage(2);
        cli.setLimit(5);
        when(scraperService.searchManga("solo", 2, 5)).thenReturn(List.of());

        assertThat(runner.execute(cli)).isEqualTo(List.of());
        verify(scraperService).searchManga("solo", 2, 5);
    }

    @Test
    void statsCommandReturnsSnapshot() {
        PerformanceStats stats = new PerformanceStats(3, 1, new CacheInfo(1, 1024, 1, 1, 0));
        when(scraperService.performanceStats()).thenReturn(stats);
        properties.getCli().setCommand(" STATS ");

        assertThat(runner.execute(properties.getCli())).isEqualTo(stats);
    }

    @Test
    void unknownCommandIsRejected() {
        properties.getCli().setCommand("download");

        assertThatThrownBy(() -> runner.execute(properties.getCli()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("download");
    }
}
