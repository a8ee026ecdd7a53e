package com.catalogcrawl.crawl.model;

import java.time.Instant;
import java.util.Map;

public record RunSummary(
    String status,
    Instant extractionTimestamp,
    Instant startedAt,
    Instant finishedAt,
    int totalProductsExtracted,
    int discoveredCount,
    int fetchFailedCount,
    int notProductCount,
    int workerErrorCount,
    int duplicateCount,
    Map<String, Integer> discoveryErrors,
    Map<String, Integer> failureReasons
) {
    /**
     * Tasks that did not end up in the output for any reason.
     */
    public int skippedCount() {
        return Math.max(0, discoveredCount - totalProductsExtracted);
    }
}
