package com.catalogcrawl.crawl.model;

import java.util.List;

public record CatalogCrawlResult(List<ProductRecord> records, RunSummary summary) {
}
