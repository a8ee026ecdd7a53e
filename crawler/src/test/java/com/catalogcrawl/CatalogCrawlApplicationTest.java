package com.catalogcrawl;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.discovery.UrlDiscoverer;
import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.output.ProductSink;
import com.catalogcrawl.crawl.products.ExtractionPolicy;
import com.catalogcrawl.crawl.service.CatalogCrawlService;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CatalogCrawlApplicationTest {

    @Autowired
    private CrawlerProperties properties;
    @Autowired
    private ExtractionPolicy extractionPolicy;
    @Autowired
    private UrlDiscoverer urlDiscoverer;
    @Autowired
    private CatalogCrawlService crawlService;
    @Autowired
    private List<ProductSink> sinks;

    @Test
    void contextWiresPipelineFromConfiguration() {
        assertThat(urlDiscoverer).isNotNull();
        assertThat(crawlService).isNotNull();
        assertThat(sinks).hasSize(1);
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getMaxRetries()).isZero();
        assertThat(properties.getDiscovery().getMode()).isEqualTo(DiscoveryMode.SITEMAP);
        assertThat(Jsoup.parse("<div id=\"product-9\"></div>").selectFirst(extractionPolicy.container())).isNotNull();
        assertThat(extractionPolicy.priceCurrent().rules()).hasSize(5);
        assertThat(extractionPolicy.isKnownBrand("Lenovo")).isTrue();
    }
}
