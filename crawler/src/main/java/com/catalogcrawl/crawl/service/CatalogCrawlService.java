package com.catalogcrawl.crawl.service;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.discovery.UrlDiscoverer;
import com.catalogcrawl.crawl.http.PageFetcher;
import com.catalogcrawl.crawl.model.CatalogCrawlResult;
import com.catalogcrawl.crawl.model.CrawlTask;
import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.model.DiscoveryResult;
import com.catalogcrawl.crawl.model.ExtractionResult;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import com.catalogcrawl.crawl.model.ProductRecord;
import com.catalogcrawl.crawl.model.RunMetadata;
import com.catalogcrawl.crawl.model.RunSummary;
import com.catalogcrawl.crawl.model.TaskOutcome;
import com.catalogcrawl.crawl.products.ProductPageExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs one crawl: discovery, then fetch and extract on the worker pool, then aggregation.
 * <p>
 * Workers hand their {@link TaskOutcome} to a completion queue. The calling thread is the only
 * consumer of that queue and the only writer of the {@link ProductAggregator}. A failed task
 * only loses its own record.
 */
@Service
public class CatalogCrawlService {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrawlService.class);
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_NO_TARGETS = "NO_TARGETS";
    public static final String STATUS_PARTIAL = "PARTIAL";

    private final UrlDiscoverer discoverer;
    private final PageFetcher fetcher;
    private final ProductPageExtractor extractor;
    private final ExecutorService crawlExecutor;
    private final CrawlerProperties properties;

    public CatalogCrawlService(
        UrlDiscoverer discoverer,
        PageFetcher fetcher,
        ProductPageExtractor extractor,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        CrawlerProperties properties
    ) {
        this.discoverer = discoverer;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.crawlExecutor = crawlExecutor;
        this.properties = properties;
    }

    public CatalogCrawlResult run() {
        return run(properties.getDiscovery().getMode());
    }

    public CatalogCrawlResult run(DiscoveryMode mode) {
        Instant startedAt = Instant.now();
        CrawlerProperties.Site site = properties.getSite();
        RunMetadata runMetadata = new RunMetadata(
            site.getSourceSite(),
            startedAt,
            site.getContactPhone(),
            site.getContactWhatsapp()
        );
        int maxDurationSeconds = properties.getRun().getMaxDurationSeconds();
        Instant deadline = maxDurationSeconds <= 0 ? null : startedAt.plusSeconds(maxDurationSeconds);

        DiscoveryResult discovery = discoverer.discover(mode);
        List<CrawlTask> tasks = discovery.tasks();
        ProductAggregator aggregator = new ProductAggregator();
        Map<String, Integer> failureReasons = new LinkedHashMap<>();
        int fetchFailed = 0;
        int notProduct = 0;
        int workerErrors = 0;
        String status;

        if (tasks.isEmpty()) {
            status = STATUS_NO_TARGETS;
            log.warn("Discovery produced no product URLs (reachable={}, errors={})", discovery.rootReachable(), discovery.errors());
        } else {
            log.info("Crawling {} product URLs with {} workers", tasks.size(), properties.getWorkerPoolSize());
            ExecutorCompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(crawlExecutor);
            List<Future<TaskOutcome>> submitted = new ArrayList<>(tasks.size());
            for (CrawlTask task : tasks) {
                submitted.add(completion.submit(() -> processTask(task, runMetadata)));
            }

            boolean stoppedEarly = false;
            for (int received = 0; received < submitted.size(); received++) {
                Future<TaskOutcome> done = nextCompleted(completion, deadline);
                if (done == null) {
                    stoppedEarly = true;
                    break;
                }
                TaskOutcome outcome;
                try {
                    outcome = done.get();
                } catch (ExecutionException e) {
                    workerErrors++;
                    failureReasons.merge("worker_exception", 1, Integer::sum);
                    log.warn("Worker task failed", e.getCause());
                    continue;
                } catch (CancellationException e) {
                    workerErrors++;
                    failureReasons.merge("worker_cancelled", 1, Integer::sum);
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stoppedEarly = true;
                    break;
                }

                switch (outcome.status()) {
                    case EXTRACTED -> {
                        if (!aggregator.offer(outcome.record())) {
                            log.debug("Duplicate product {} from {}", outcome.record().identifier(), outcome.task().url());
                        }
                    }
                    case FETCH_FAILED -> {
                        fetchFailed++;
                        failureReasons.merge("fetch_" + outcome.reason(), 1, Integer::sum);
                    }
                    case NOT_A_PRODUCT -> {
                        notProduct++;
                        failureReasons.merge(outcome.reason().toLowerCase(Locale.ROOT), 1, Integer::sum);
                    }
                    case WORKER_ERROR -> {
                        workerErrors++;
                        failureReasons.merge("worker_" + outcome.reason(), 1, Integer::sum);
                    }
                }
            }

            if (stoppedEarly) {
                int cancelled = 0;
                for (Future<TaskOutcome> future : submitted) {
                    if (future.cancel(true)) {
                        cancelled++;
                    }
                }
                log.warn("Run stopped before completion; cancelled {} outstanding task(s)", cancelled);
                status = STATUS_PARTIAL;
            } else {
                status = STATUS_COMPLETED;
            }
        }

        Instant finishedAt = Instant.now();
        RunSummary summary = new RunSummary(
            status,
            runMetadata.scrapeTimestamp(),
            startedAt,
            finishedAt,
            aggregator.size(),
            tasks.size(),
            fetchFailed,
            notProduct,
            workerErrors,
            aggregator.duplicateCount(),
            discovery.errors(),
            failureReasons
        );
        log.info(
            "Crawl {} in {}s: products={}, discovered={}, fetchFailed={}, notProduct={}, duplicates={}, peakInFlight={}",
            status,
            Duration.between(startedAt, finishedAt).toSeconds(),
            summary.totalProductsExtracted(),
            summary.discoveredCount(),
            summary.fetchFailedCount(),
            summary.notProductCount(),
            summary.duplicateCount(),
            fetcher.peakInFlight()
        );
        return new CatalogCrawlResult(aggregator.records(), summary);
    }

    TaskOutcome processTask(CrawlTask task, RunMetadata runMetadata) {
        try {
            HttpFetchResult fetch = fetcher.fetch(task.url());
            if (!fetch.isSuccessful()) {
                return TaskOutcome.fetchFailed(task, fetch.failureKey());
            }
            ExtractionResult extraction = extractor.extract(fetch.body(), task.url(), runMetadata);
            if (!extraction.isSuccess()) {
                log.debug("No product at {}: {}", task.url(), extraction.failure());
                return TaskOutcome.notAProduct(task, extraction.failure().name());
            }
            if (!extraction.missingFields().isEmpty()) {
                log.debug("Product at {} is missing {}", task.url(), extraction.missingFields());
            }
            ProductRecord record = extraction.record();
            if (task.contextLabel() != null) {
                record = record.withSourceCategory(task.contextLabel());
            }
            return TaskOutcome.extracted(task, record);
        } catch (RuntimeException e) {
            log.warn("Worker failed on {}", task.url(), e);
            return TaskOutcome.workerError(task, e.getClass().getSimpleName());
        }
    }

    private Future<TaskOutcome> nextCompleted(ExecutorCompletionService<TaskOutcome> completion, Instant deadline) {
        try {
            if (deadline == null) {
                return completion.take();
            }
            long remainingMs = Duration.between(Instant.now(), deadline).toMillis();
            if (remainingMs <= 0) {
                return completion.poll();
            }
            return completion.poll(remainingMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}
