package com.catalogcrawl.crawl.model;

public enum ExtractionFailure {
    EMPTY_DOCUMENT,
    NO_PRODUCT_CONTAINER,
    MALFORMED_DOCUMENT
}
