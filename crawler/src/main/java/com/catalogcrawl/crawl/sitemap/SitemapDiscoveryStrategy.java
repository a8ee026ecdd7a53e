package com.catalogcrawl.crawl.sitemap;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.discovery.UrlDiscoveryStrategy;
import com.catalogcrawl.crawl.http.PageFetcher;
import com.catalogcrawl.crawl.model.CrawlTask;
import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.model.DiscoveryResult;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.zip.GZIPInputStream;

/**
 * Sitemap-index discovery: index, then every nested product sitemap, then the leaf
 * {@code <url><loc>} entries.
 */
@Service
public class SitemapDiscoveryStrategy implements UrlDiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(SitemapDiscoveryStrategy.class);
    static final String INDEX_UNREACHABLE = "sitemap_index_unreachable";

    private final PageFetcher fetcher;
    private final CrawlerProperties properties;
    private final ExecutorService discoveryExecutor;

    public SitemapDiscoveryStrategy(
        PageFetcher fetcher,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        this.fetcher = fetcher;
        this.properties = properties;
        this.discoveryExecutor = discoveryExecutor;
    }

    @Override
    public DiscoveryMode mode() {
        return DiscoveryMode.SITEMAP;
    }

    @Override
    public DiscoveryResult discover() {
        String indexUrl = properties.getDiscovery().getSitemapIndexUrl();
        Map<String, Integer> errors = new LinkedHashMap<>();

        HttpFetchResult indexFetch = fetcher.fetch(indexUrl, PageFetcher.XML_ACCEPT);
        if (!indexFetch.isSuccessful()) {
            log.warn("Sitemap index {} unreachable: {}", indexUrl, indexFetch.failureKey());
            increment(errors, INDEX_UNREACHABLE);
            increment(errors, indexFetch.failureKey());
            return DiscoveryResult.unreachable(mode(), errors);
        }
        Document index;
        try {
            index = parseXml(indexFetch);
        } catch (IOException e) {
            log.warn("Sitemap index {} could not be decoded", indexUrl, e);
            increment(errors, INDEX_UNREACHABLE);
            increment(errors, "gzip_decode_error");
            return DiscoveryResult.unreachable(mode(), errors);
        }

        String filter = properties.getDiscovery().getProductSitemapFilter();
        List<String> productSitemaps = new ArrayList<>();
        for (Element loc : index.select("sitemap > loc")) {
            String child = normalizeLocation(loc.text());
            if (child != null && child.contains(filter) && !productSitemaps.contains(child)) {
                productSitemaps.add(child);
            }
        }
        log.info("Sitemap index {} lists {} product sitemap(s)", indexUrl, productSitemaps.size());

        LinkedHashSet<String> productUrls = new LinkedHashSet<>();
        List<CompletableFuture<HttpFetchResult>> fetches = new ArrayList<>();
        for (String sitemapUrl : productSitemaps) {
            fetches.add(CompletableFuture.supplyAsync(
                () -> fetcher.fetch(sitemapUrl, PageFetcher.XML_ACCEPT),
                discoveryExecutor
            ));
        }

        int fetchedSitemaps = 0;
        for (int i = 0; i < fetches.size(); i++) {
            String sitemapUrl = productSitemaps.get(i);
            HttpFetchResult fetch = fetches.get(i).join();
            if (!fetch.isSuccessful()) {
                log.debug("Product sitemap {} failed: {}", sitemapUrl, fetch.failureKey());
                increment(errors, fetch.failureKey());
                continue;
            }
            try {
                List<String> leaves = leafLocations(parseXml(fetch));
                if (leaves.isEmpty()) {
                    increment(errors, "empty_sitemap_payload");
                }
                productUrls.addAll(leaves);
                fetchedSitemaps++;
            } catch (IOException e) {
                increment(errors, "gzip_decode_error");
            }
        }

        List<CrawlTask> tasks = productUrls.stream()
            .map(url -> new CrawlTask(url, null))
            .toList();
        return new DiscoveryResult(mode(), true, 1 + fetchedSitemaps, tasks, errors);
    }

    private List<String> leafLocations(Document xml) {
        List<String> out = new ArrayList<>();
        for (Element loc : xml.select("url > loc")) {
            String location = normalizeLocation(loc.text());
            if (location != null) {
                out.add(location);
            }
        }
        return out;
    }

    private Document parseXml(HttpFetchResult fetch) throws IOException {
        String payload = extractXmlPayload(fetch);
        return Jsoup.parse(payload == null ? "" : payload, "", Parser.xmlParser());
    }

    private String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(byte[] bodyBytes) {
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeLocation(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        String normalized = location.trim();
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        return normalized;
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }
}
