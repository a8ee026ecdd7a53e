package com.catalogcrawl.crawl.service;

import com.catalogcrawl.crawl.model.ProductRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First-writer-wins collection of extracted records, keyed by identifier (or source URL when a
 * record has none). Not thread-safe: only the coordinator thread that drains the completion
 * queue touches it.
 */
public class ProductAggregator {
    private final Map<String, ProductRecord> records = new LinkedHashMap<>();
    private int duplicateCount;

    /**
     * @return false if a record with the same key was already accepted
     */
    public boolean offer(ProductRecord record) {
        String key = keyOf(record);
        if (records.putIfAbsent(key, record) != null) {
            duplicateCount++;
            return false;
        }
        return true;
    }

    public List<ProductRecord> records() {
        return List.copyOf(records.values());
    }

    public int size() {
        return records.size();
    }

    public int duplicateCount() {
        return duplicateCount;
    }

    static String keyOf(ProductRecord record) {
        String identifier = record.identifier();
        if (identifier != null && !identifier.isBlank()) {
            return identifier;
        }
        return record.sourceUrl();
    }
}
