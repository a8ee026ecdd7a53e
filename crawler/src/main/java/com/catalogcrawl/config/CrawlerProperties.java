package com.catalogcrawl.config;

import com.catalogcrawl.crawl.model.DiscoveryMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int maxConcurrentFetches = 10;
    private int maxRetries = 2;
    private int requestTimeoutSeconds = 8;
    private int retryBaseDelayMs = 1000;
    private int retryMaxDelayMs = 30_000;
    private int workerPoolSize = 10;
    private Discovery discovery = new Discovery();
    private Extraction extraction = new Extraction();
    private Site site = new Site();
    private Output output = new Output();
    private Run run = new Run();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxConcurrentFetches() {
        return Math.max(1, maxConcurrentFetches);
    }

    public void setMaxConcurrentFetches(int maxConcurrentFetches) {
        this.maxConcurrentFetches = Math.max(1, maxConcurrentFetches);
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public int getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
    }

    public int getWorkerPoolSize() {
        return Math.max(1, workerPoolSize);
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = Math.max(1, workerPoolSize);
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Site getSite() {
        return site;
    }

    public void setSite(Site site) {
        this.site = site;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Discovery {
        private DiscoveryMode mode = DiscoveryMode.SITEMAP;
        private String sitemapIndexUrl = "https://www.laptop.lk/sitemap_index.xml";
        private String productSitemapFilter = "product-sitemap";
        private String baseUrl = "https://www.laptop.lk";
        private String categoryPathPrefix = "https://www.laptop.lk/index.php/product-category/";
        private String productLinkSelector = "a.woocommerce-LoopProduct-link";
        private int maxPagesPerCategory = 500;

        public DiscoveryMode getMode() {
            return mode == null ? DiscoveryMode.SITEMAP : mode;
        }

        public void setMode(DiscoveryMode mode) {
            this.mode = mode;
        }

        public String getSitemapIndexUrl() {
            return sitemapIndexUrl;
        }

        public void setSitemapIndexUrl(String sitemapIndexUrl) {
            this.sitemapIndexUrl = sitemapIndexUrl;
        }

        public String getProductSitemapFilter() {
            return productSitemapFilter == null ? "" : productSitemapFilter;
        }

        public void setProductSitemapFilter(String productSitemapFilter) {
            this.productSitemapFilter = productSitemapFilter;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCategoryPathPrefix() {
            return categoryPathPrefix;
        }

        public void setCategoryPathPrefix(String categoryPathPrefix) {
            this.categoryPathPrefix = categoryPathPrefix;
        }

        public String getProductLinkSelector() {
            return productLinkSelector;
        }

        public void setProductLinkSelector(String productLinkSelector) {
            this.productLinkSelector = productLinkSelector;
        }

        public int getMaxPagesPerCategory() {
            return Math.max(1, maxPagesPerCategory);
        }

        public void setMaxPagesPerCategory(int maxPagesPerCategory) {
            this.maxPagesPerCategory = Math.max(1, maxPagesPerCategory);
        }
    }

    /**
     * Site-specific markup knowledge. Each list is an ordered fallback chain of
     * {@code css selector} or {@code css selector@attribute} rules.
     */
    public static class Extraction {
        private String containerSelector = "div[id^=product-]";
        private String currency = "LKR";
        private List<String> title = new ArrayList<>(List.of(
            "h1.product_title",
            "h1.entry-title",
            ".product_title"
        ));
        private List<String> priceCurrent = new ArrayList<>(List.of(
            "p.price ins .amount",
            "span.electro-price ins .amount",
            "p.price > .amount",
            "span.electro-price > .amount",
            "p.price bdi"
        ));
        private List<String> priceOriginal = new ArrayList<>(List.of(
            "p.price del .amount",
            "span.electro-price del .amount"
        ));
        private List<String> description = new ArrayList<>(List.of(
            "div#tab-description@html",
            "div.woocommerce-product-details__short-description@html",
            "div.woocommerce-tabs@html"
        ));
        private List<String> categories = new ArrayList<>(List.of("span.posted_in a"));
        private List<String> images = new ArrayList<>(List.of(
            "div.woocommerce-product-gallery__image a@href",
            "figure.woocommerce-product-gallery__wrapper img@src"
        ));
        private List<String> rating = new ArrayList<>(List.of(
            "div.star-rating@title",
            "div.star-rating strong.rating"
        ));
        private String outOfStockSelector = "p.stock.out-of-stock";
        private String warrantyImageSelector = "img[alt*=warranty]";
        private String specTableSelector = "table.shop_attributes";
        private String specBlockSelector = "div#tab-specification";
        private List<String> knownBrands = new ArrayList<>(List.of(
            "hp", "dell", "apple", "lenovo", "asus", "msi", "acer", "samsung"
        ));

        public String getContainerSelector() {
            return containerSelector;
        }

        public void setContainerSelector(String containerSelector) {
            this.containerSelector = containerSelector;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public List<String> getTitle() {
            return title;
        }

        public void setTitle(List<String> title) {
            this.title = title;
        }

        public List<String> getPriceCurrent() {
            return priceCurrent;
        }

        public void setPriceCurrent(List<String> priceCurrent) {
            this.priceCurrent = priceCurrent;
        }

        public List<String> getPriceOriginal() {
            return priceOriginal;
        }

        public void setPriceOriginal(List<String> priceOriginal) {
            this.priceOriginal = priceOriginal;
        }

        public List<String> getDescription() {
            return description;
        }

        public void setDescription(List<String> description) {
            this.description = description;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories;
        }

        public List<String> getImages() {
            return images;
        }

        public void setImages(List<String> images) {
            this.images = images;
        }

        public List<String> getRating() {
            return rating;
        }

        public void setRating(List<String> rating) {
            this.rating = rating;
        }

        public String getOutOfStockSelector() {
            return outOfStockSelector;
        }

        public void setOutOfStockSelector(String outOfStockSelector) {
            this.outOfStockSelector = outOfStockSelector;
        }

        public String getWarrantyImageSelector() {
            return warrantyImageSelector;
        }

        public void setWarrantyImageSelector(String warrantyImageSelector) {
            this.warrantyImageSelector = warrantyImageSelector;
        }

        public String getSpecTableSelector() {
            return specTableSelector;
        }

        public void setSpecTableSelector(String specTableSelector) {
            this.specTableSelector = specTableSelector;
        }

        public String getSpecBlockSelector() {
            return specBlockSelector;
        }

        public void setSpecBlockSelector(String specBlockSelector) {
            this.specBlockSelector = specBlockSelector;
        }

        public List<String> getKnownBrands() {
            return knownBrands;
        }

        public void setKnownBrands(List<String> knownBrands) {
            this.knownBrands = knownBrands;
        }
    }

    public static class Site {
        private String sourceSite = "laptop.lk";
        private String contactPhone = "+94 77 733 6464";
        private String contactWhatsapp = "+94 77 733 6464";

        public String getSourceSite() {
            return sourceSite;
        }

        public void setSourceSite(String sourceSite) {
            this.sourceSite = sourceSite;
        }

        public String getContactPhone() {
            return contactPhone;
        }

        public void setContactPhone(String contactPhone) {
            this.contactPhone = contactPhone;
        }

        public String getContactWhatsapp() {
            return contactWhatsapp;
        }

        public void setContactWhatsapp(String contactWhatsapp) {
            this.contactWhatsapp = contactWhatsapp;
        }
    }

    public static class Output {
        private String path = "catalog_products.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Run {
        private int maxDurationSeconds = 0;

        public int getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
