package com.catalogcrawl.crawl.output;

import com.catalogcrawl.crawl.model.ProductRecord;
import com.catalogcrawl.crawl.model.RunSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogExport(ExtractionInfo extractionInfo, List<ProductRecord> products) {

    public static CatalogExport of(List<ProductRecord> records, RunSummary summary) {
        return new CatalogExport(
            new ExtractionInfo(records.size(), summary.extractionTimestamp()),
            records
        );
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExtractionInfo(int totalProductsExtracted, Instant extractionTimestamp) {
    }
}
