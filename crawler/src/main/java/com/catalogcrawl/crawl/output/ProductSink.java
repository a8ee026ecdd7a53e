package com.catalogcrawl.crawl.output;

import com.catalogcrawl.crawl.model.ProductRecord;
import com.catalogcrawl.crawl.model.RunSummary;

import java.util.List;

/**
 * Receives the finished record collection of a run.
 */
public interface ProductSink {

    void accept(List<ProductRecord> records, RunSummary summary);
}
