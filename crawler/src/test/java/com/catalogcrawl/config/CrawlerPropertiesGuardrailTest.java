package com.catalogcrawl.config;

import com.catalogcrawl.crawl.model.DiscoveryMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyRetriesAndPoolAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrentFetches(0);
        properties.setMaxRetries(-3);
        properties.setRequestTimeoutSeconds(0);
        properties.setWorkerPoolSize(-1);
        properties.getDiscovery().setMaxPagesPerCategory(0);
        assertEquals(1, properties.getMaxConcurrentFetches());
        assertEquals(0, properties.getMaxRetries());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(1, properties.getWorkerPoolSize());
        assertEquals(1, properties.getDiscovery().getMaxPagesPerCategory());
    }

    @Test
    void missingDiscoveryModeMeansSitemap() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getDiscovery().setMode(null);
        assertEquals(DiscoveryMode.SITEMAP, properties.getDiscovery().getMode());
    }
}
