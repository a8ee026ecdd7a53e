package com.catalogcrawl.crawl.sitemap;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.http.PageFetcher;
import com.catalogcrawl.crawl.model.CrawlTask;
import com.catalogcrawl.crawl.model.DiscoveryResult;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SitemapDiscoveryGzipTest {
    private static final String INDEX_URL = "https://shop.example/sitemap_index.xml";
    private static final String PRODUCT_SITEMAP_URL = "https://shop.example/product-sitemap.xml.gz";

    @Mock
    private PageFetcher fetcher;

    private final ExecutorService discoveryExecutor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        discoveryExecutor.shutdownNow();
    }

    @Test
    void readsGzippedProductSitemapByMagicBytes() throws Exception {
        String index = """
            <?xml version="1.0" encoding="UTF-8"?>
            <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <sitemap><loc>https://shop.example/product-sitemap.xml.gz</loc></sitemap>
            </sitemapindex>
            """;
        String urlset = """
            <?xml version="1.0" encoding="UTF-8"?>
            <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <url><loc>https://shop.example/product/hp-victus-15/</loc></url>
              <url><loc>https://shop.example/product/dell-xps-13/</loc></url>
              <url><loc>/relative/is-ignored/</loc></url>
            </urlset>
            """;
        when(fetcher.fetch(eq(INDEX_URL), eq(PageFetcher.XML_ACCEPT)))
            .thenReturn(ok(INDEX_URL, index.getBytes(StandardCharsets.UTF_8)));
        when(fetcher.fetch(eq(PRODUCT_SITEMAP_URL), eq(PageFetcher.XML_ACCEPT)))
            .thenReturn(ok(PRODUCT_SITEMAP_URL, gzip(urlset)));

        DiscoveryResult result = strategy().discover();

        assertTrue(result.rootReachable());
        assertEquals(
            List.of("https://shop.example/product/hp-victus-15/", "https://shop.example/product/dell-xps-13/"),
            result.tasks().stream().map(CrawlTask::url).toList()
        );
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void corruptGzipPayloadIsCounted() {
        String index = """
            <sitemapindex>
              <sitemap><loc>https://shop.example/product-sitemap.xml.gz</loc></sitemap>
            </sitemapindex>
            """;
        byte[] truncated = {0x1f, (byte) 0x8b, 0x08, 0x00, 0x01};
        when(fetcher.fetch(eq(INDEX_URL), eq(PageFetcher.XML_ACCEPT)))
            .thenReturn(ok(INDEX_URL, index.getBytes(StandardCharsets.UTF_8)));
        when(fetcher.fetch(eq(PRODUCT_SITEMAP_URL), eq(PageFetcher.XML_ACCEPT)))
            .thenReturn(ok(PRODUCT_SITEMAP_URL, truncated));

        DiscoveryResult result = strategy().discover();

        assertTrue(result.rootReachable());
        assertTrue(result.tasks().isEmpty());
        assertEquals(1, result.errors().get("gzip_decode_error"));
        assertFalse(result.errors().containsKey(SitemapDiscoveryStrategy.INDEX_UNREACHABLE));
    }

    private SitemapDiscoveryStrategy strategy() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getDiscovery().setSitemapIndexUrl(INDEX_URL);
        return new SitemapDiscoveryStrategy(fetcher, properties, discoveryExecutor);
    }

    private static HttpFetchResult ok(String url, byte[] bytes) {
        return new HttpFetchResult(
            url,
            URI.create(url),
            200,
            null,
            bytes,
            "application/xml",
            null,
            Instant.now(),
            Duration.ofMillis(20),
            1,
            null,
            null
        );
    }

    private static byte[] gzip(String text) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
