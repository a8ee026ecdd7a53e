package com.catalogcrawl.crawl.model;

public record CategoryLink(String name, String url) {
}
