package com.catalogcrawl.crawl.model;

import java.util.List;

/**
 * Either a record or the reason no record was produced. {@code missingFields} lists the
 * optional fields whose whole fallback chain came up empty.
 */
public record ExtractionResult(
    ProductRecord record,
    ExtractionFailure failure,
    List<String> missingFields
) {
    public static ExtractionResult success(ProductRecord record, List<String> missingFields) {
        return new ExtractionResult(record, null, List.copyOf(missingFields));
    }

    public static ExtractionResult failed(ExtractionFailure failure) {
        return new ExtractionResult(null, failure, List.of());
    }

    public boolean isSuccess() {
        return record != null;
    }
}
