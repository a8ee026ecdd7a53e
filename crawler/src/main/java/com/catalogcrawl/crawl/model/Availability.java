package com.catalogcrawl.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Availability {
    IN_STOCK("InStock"),
    OUT_OF_STOCK("OutOfStock");

    private final String label;

    Availability(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
