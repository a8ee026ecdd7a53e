package com.catalogcrawl.crawl.discovery;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.http.PageFetcher;
import com.catalogcrawl.crawl.model.CategoryLink;
import com.catalogcrawl.crawl.model.CrawlTask;
import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.model.DiscoveryResult;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Category-root discovery. Categories are walked in parallel, but the pages of one category
 * are fetched in order because page N+1 is only known to exist once page N had products.
 */
@Service
public class PaginationDiscoveryStrategy implements UrlDiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(PaginationDiscoveryStrategy.class);
    static final String ROOT_UNREACHABLE = "category_root_unreachable";

    private final PageFetcher fetcher;
    private final CrawlerProperties properties;
    private final ExecutorService discoveryExecutor;

    public PaginationDiscoveryStrategy(
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
        return DiscoveryMode.PAGINATION;
    }

    @Override
    public DiscoveryResult discover() {
        String baseUrl = properties.getDiscovery().getBaseUrl();
        Map<String, Integer> errors = new LinkedHashMap<>();

        HttpFetchResult rootFetch = fetcher.fetch(baseUrl);
        if (!rootFetch.isSuccessful() || rootFetch.body() == null) {
            log.warn("Category root {} unreachable: {}", baseUrl, rootFetch.failureKey());
            errors.merge(ROOT_UNREACHABLE, 1, Integer::sum);
            errors.merge(rootFetch.failureKey(), 1, Integer::sum);
            return DiscoveryResult.unreachable(mode(), errors);
        }

        List<CategoryLink> categories = findCategories(Jsoup.parse(rootFetch.body(), rootFetch.finalUrlOrRequested()));
        log.info("Found {} categories under {}", categories.size(), baseUrl);

        List<CompletableFuture<CategoryWalk>> walks = new ArrayList<>();
        for (CategoryLink category : categories) {
            walks.add(CompletableFuture.supplyAsync(() -> walkCategory(category), discoveryExecutor));
        }

        Map<String, String> productUrls = new LinkedHashMap<>();
        int pagesFetched = 0;
        for (CompletableFuture<CategoryWalk> future : walks) {
            CategoryWalk walk = future.join();
            pagesFetched += walk.pagesFetched();
            walk.errors().forEach((key, count) -> errors.merge(key, count, Integer::sum));
            for (String url : walk.productUrls()) {
                productUrls.putIfAbsent(url, walk.category().name());
            }
            log.debug("Category {}: {} products over {} page(s)", walk.category().name(), walk.productUrls().size(), walk.pagesFetched());
        }

        List<CrawlTask> tasks = productUrls.entrySet().stream()
            .map(entry -> new CrawlTask(entry.getKey(), entry.getValue()))
            .toList();
        return new DiscoveryResult(mode(), true, 1 + pagesFetched, tasks, errors);
    }

    /**
     * Anchors under the category prefix, deduplicated by exact URL. The first label seen for a
     * URL is kept.
     */
    public List<CategoryLink> findCategories(Document root) {
        String prefix = properties.getDiscovery().getCategoryPathPrefix();
        Map<String, String> byUrl = new LinkedHashMap<>();
        for (Element anchor : root.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                href = anchor.attr("href").trim();
            }
            if (!href.startsWith(prefix) || href.equals(prefix)) {
                continue;
            }
            String name = anchor.text().trim();
            if (name.isEmpty()) {
                continue;
            }
            byUrl.putIfAbsent(href, name);
        }
        List<CategoryLink> categories = new ArrayList<>();
        byUrl.forEach((url, name) -> categories.add(new CategoryLink(name, url)));
        return categories;
    }

    /**
     * Walks {@code page/1, page/2, ...} until a page has no product links, answers 404, or fails.
     */
    public CategoryWalk walkCategory(CategoryLink category) {
        String selector = properties.getDiscovery().getProductLinkSelector();
        int maxPages = properties.getDiscovery().getMaxPagesPerCategory();
        List<String> productUrls = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        int pagesFetched = 0;

        for (int page = 1; page <= maxPages; page++) {
            String pageUrl = pageUrl(category.url(), page);
            HttpFetchResult fetch = fetcher.fetchListing(pageUrl);
            pagesFetched++;
            if (fetch.isNotFound()) {
                break;
            }
            if (!fetch.isSuccessful() || fetch.body() == null) {
                log.debug("Listing page {} failed: {}", pageUrl, fetch.failureKey());
                errors.merge(fetch.failureKey(), 1, Integer::sum);
                break;
            }
            Document document = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
            List<String> links = new ArrayList<>();
            for (Element anchor : document.select(selector)) {
                String href = anchor.absUrl("href");
                if (!href.isBlank()) {
                    links.add(href);
                }
            }
            if (links.isEmpty()) {
                break;
            }
            productUrls.addAll(links);
            if (page == maxPages) {
                log.warn("Category {} hit the page limit of {}", category.name(), maxPages);
                errors.merge("max_pages_reached", 1, Integer::sum);
            }
        }
        return new CategoryWalk(category, productUrls, pagesFetched, errors);
    }

    static String pageUrl(String categoryUrl, int page) {
        if (page <= 1) {
            return categoryUrl;
        }
        String base = categoryUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/page/" + page + "/";
    }

    public record CategoryWalk(
        CategoryLink category,
        List<String> productUrls,
        int pagesFetched,
        Map<String, Integer> errors
    ) {
    }
}
