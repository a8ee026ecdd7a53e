package com.catalogcrawl.crawl.service;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.CatalogCrawlResult;
import com.catalogcrawl.crawl.model.RunSummary;
import com.catalogcrawl.crawl.output.ProductSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlCliRunnerTest {

    @Mock
    private CatalogCrawlService crawlService;
    @Mock
    private ProductSink sink;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void runsCrawlAndHandsResultToEverySink() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setExitAfterRun(false);
        Instant now = Instant.now();
        RunSummary summary = new RunSummary(
            CatalogCrawlService.STATUS_NO_TARGETS, now, now, now, 0, 0, 0, 0, 0, 0, Map.of(), Map.of()
        );
        when(crawlService.run()).thenReturn(new CatalogCrawlResult(List.of(), summary));

        new CrawlCliRunner(properties, crawlService, List.of(sink), applicationContext)
            .run(new DefaultApplicationArguments());

        verify(sink).accept(List.of(), summary);
        verifyNoInteractions(applicationContext);
    }

    @Test
    void disabledRunnerDoesNothing() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(false);

        new CrawlCliRunner(properties, crawlService, List.of(sink), applicationContext)
            .run(new DefaultApplicationArguments());

        verifyNoInteractions(crawlService, sink, applicationContext);
    }
}
