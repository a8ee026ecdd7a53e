package com.catalogcrawl.crawl.model;

/**
 * One product page to fetch and extract. {@code contextLabel} is the category name when the
 * URL came from a category walk, otherwise null.
 */
public record CrawlTask(String url, String contextLabel) {
}
