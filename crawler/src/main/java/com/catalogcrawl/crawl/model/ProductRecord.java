package com.catalogcrawl.crawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProductRecord(
    String identifier,
    String sourceUrl,
    String title,
    String brand,
    List<String> categoryPath,
    String priceCurrent,
    String priceOriginal,
    String currency,
    Availability availability,
    String warranty,
    @JsonProperty("description_html") String description,
    Map<String, String> specifications,
    boolean specificationsFound,
    List<String> images,
    String rating,
    String sourceCategory,
    RunMetadata runMetadata
) {
    public ProductRecord {
        categoryPath = categoryPath == null ? List.of() : List.copyOf(categoryPath);
        specifications = specifications == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(specifications));
        images = images == null ? List.of() : List.copyOf(images);
    }

    public ProductRecord withSourceCategory(String label) {
        return new ProductRecord(
            identifier,
            sourceUrl,
            title,
            brand,
            categoryPath,
            priceCurrent,
            priceOriginal,
            currency,
            availability,
            warranty,
            description,
            specifications,
            specificationsFound,
            images,
            rating,
            label,
            runMetadata
        );
    }
}
