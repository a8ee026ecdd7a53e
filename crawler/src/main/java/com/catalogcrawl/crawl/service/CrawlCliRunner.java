package com.catalogcrawl.crawl.service;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.CatalogCrawlResult;
import com.catalogcrawl.crawl.model.RunSummary;
import com.catalogcrawl.crawl.output.ProductSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CatalogCrawlService crawlService;
    private final List<ProductSink> sinks;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CatalogCrawlService crawlService,
        List<ProductSink> sinks,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlService = crawlService;
        this.sinks = sinks;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CatalogCrawlResult result = crawlService.run();
        for (ProductSink sink : sinks) {
            sink.accept(result.records(), result.summary());
        }

        RunSummary summary = result.summary();
        log.info(
            "Summary: status={}, products={}, discovered={}, skipped={}, duplicates={}, failures={}, discoveryErrors={}",
            summary.status(),
            summary.totalProductsExtracted(),
            summary.discoveredCount(),
            summary.skippedCount(),
            summary.duplicateCount(),
            summary.failureReasons(),
            summary.discoveryErrors()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
