package com.catalogcrawl.crawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Created once per run and shared by every record of that run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunMetadata(
    String sourceSite,
    Instant scrapeTimestamp,
    String shopContactPhone,
    String shopContactWhatsapp
) {
}
