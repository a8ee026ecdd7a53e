package com.catalogcrawl.crawl.model;

public enum DiscoveryMode {
    SITEMAP,
    PAGINATION
}
