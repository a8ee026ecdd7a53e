package com.catalogcrawl.crawl.products;

import com.catalogcrawl.config.CrawlerProperties;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compiled form of {@code crawler.extraction.*}: where each field lives in the site's markup.
 * Every selector is parsed once here, so a bad value fails when the policy is built.
 */
public record ExtractionPolicy(
    Evaluator container,
    String currency,
    SelectorChain title,
    SelectorChain priceCurrent,
    SelectorChain priceOriginal,
    SelectorChain description,
    SelectorChain categories,
    SelectorChain images,
    SelectorChain rating,
    Evaluator outOfStock,
    Evaluator warrantyImage,
    Evaluator specTable,
    Evaluator specBlock,
    Set<String> knownBrands
) {
    public static ExtractionPolicy fromProperties(CrawlerProperties.Extraction extraction) {
        return new ExtractionPolicy(
            compile(extraction.getContainerSelector()),
            extraction.getCurrency(),
            SelectorChain.of(extraction.getTitle()),
            SelectorChain.of(extraction.getPriceCurrent()),
            SelectorChain.of(extraction.getPriceOriginal()),
            SelectorChain.of(extraction.getDescription()),
            SelectorChain.of(extraction.getCategories()),
            SelectorChain.of(extraction.getImages()),
            SelectorChain.of(extraction.getRating()),
            compile(extraction.getOutOfStockSelector()),
            compile(extraction.getWarrantyImageSelector()),
            compile(extraction.getSpecTableSelector()),
            compile(extraction.getSpecBlockSelector()),
            lowerCased(extraction.getKnownBrands())
        );
    }

    public static ExtractionPolicy defaults() {
        return fromProperties(new CrawlerProperties.Extraction());
    }

    public boolean isKnownBrand(String label) {
        return label != null && knownBrands.contains(label.trim().toLowerCase(Locale.ROOT));
    }

    private static Evaluator compile(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("Extraction selector must not be blank");
        }
        return QueryParser.parse(selector.trim());
    }

    private static Set<String> lowerCased(List<String> brands) {
        Set<String> out = new LinkedHashSet<>();
        if (brands != null) {
            for (String brand : brands) {
                if (brand != null && !brand.isBlank()) {
                    out.add(brand.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Set.copyOf(out);
    }
}
