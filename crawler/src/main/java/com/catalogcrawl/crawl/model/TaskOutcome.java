package com.catalogcrawl.crawl.model;

public record TaskOutcome(
    CrawlTask task,
    Status status,
    ProductRecord record,
    String reason
) {
    public enum Status {
        EXTRACTED,
        FETCH_FAILED,
        NOT_A_PRODUCT,
        WORKER_ERROR
    }

    public static TaskOutcome extracted(CrawlTask task, ProductRecord record) {
        return new TaskOutcome(task, Status.EXTRACTED, record, null);
    }

    public static TaskOutcome fetchFailed(CrawlTask task, String reason) {
        return new TaskOutcome(task, Status.FETCH_FAILED, null, reason);
    }

    public static TaskOutcome notAProduct(CrawlTask task, String reason) {
        return new TaskOutcome(task, Status.NOT_A_PRODUCT, null, reason);
    }

    public static TaskOutcome workerError(CrawlTask task, String reason) {
        return new TaskOutcome(task, Status.WORKER_ERROR, null, reason);
    }
}
