package com.catalogcrawl.crawl.products;

import com.catalogcrawl.crawl.model.Availability;
import com.catalogcrawl.crawl.model.ExtractionFailure;
import com.catalogcrawl.crawl.model.ExtractionResult;
import com.catalogcrawl.crawl.model.ProductRecord;
import com.catalogcrawl.crawl.model.RunMetadata;
import com.catalogcrawl.crawl.util.PriceNormalizer;
import com.catalogcrawl.crawl.util.UrlCanonicalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses one product page into a {@link ProductRecord}.
 * <p>
 * The product container is the only hard requirement. Every other field is optional and read
 * through its fallback chain from the {@link ExtractionPolicy}.
 */
@Component
public class ProductPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(ProductPageExtractor.class);
    static final String PRICE_NOT_FOUND = "0";
    private static final String WARRANTY = "warranty";
    private static final String LINE_BREAKING_TAGS = "p, li, div, tr, dt, dd, br, h1, h2, h3, h4, h5, h6";

    private final ExtractionPolicy policy;

    public ProductPageExtractor(ExtractionPolicy policy) {
        this.policy = policy;
    }

    public ExtractionResult extract(String html, String sourceUrl, RunMetadata runMetadata) {
        if (html == null || html.isBlank()) {
            return ExtractionResult.failed(ExtractionFailure.EMPTY_DOCUMENT);
        }
        try {
            Document document = Jsoup.parse(html, sourceUrl == null ? "" : sourceUrl);
            return extractFromDocument(document, sourceUrl, runMetadata);
        } catch (RuntimeException e) {
            log.debug("Unexpected page structure at {}", sourceUrl, e);
            return ExtractionResult.failed(ExtractionFailure.MALFORMED_DOCUMENT);
        }
    }

    private ExtractionResult extractFromDocument(Document document, String sourceUrl, RunMetadata runMetadata) {
        Element container = document.selectFirst(policy.container());
        if (container == null) {
            return ExtractionResult.failed(ExtractionFailure.NO_PRODUCT_CONTAINER);
        }
        List<String> missing = new ArrayList<>();

        String title = orMissing(policy.title().first(container), "title", missing);
        String description = orMissing(policy.description().first(container), "description", missing);
        String rating = orMissing(policy.rating().first(container), "rating", missing);

        String priceCurrent = orMissing(
            policy.priceCurrent().first(container, PriceNormalizer::normalize),
            "price_current",
            missing
        );
        if (priceCurrent == null) {
            priceCurrent = PRICE_NOT_FOUND;
        }
        String priceOriginal = policy.priceOriginal().first(container, PriceNormalizer::normalize).orElse(null);

        List<String> labels = policy.categories().all(container);
        String brand = labels.stream().filter(policy::isKnownBrand).findFirst().orElse(null);
        if (brand == null) {
            missing.add("brand");
        }
        List<String> categoryPath = labels.stream()
            .filter(label -> brand == null || !label.equalsIgnoreCase(brand))
            .toList();

        Availability availability = container.selectFirst(policy.outOfStock()) != null
            ? Availability.OUT_OF_STOCK
            : Availability.IN_STOCK;

        String warranty = orMissing(extractWarranty(document, container), "warranty", missing);

        Map<String, String> specifications = extractSpecifications(document);
        if (specifications.isEmpty()) {
            missing.add("specifications");
        }

        List<String> images = new ArrayList<>(new LinkedHashSet<>(policy.images().allUrls(container)));
        if (images.isEmpty()) {
            missing.add("images");
        }

        ProductRecord record = new ProductRecord(
            identifierFor(container, sourceUrl),
            sourceUrl,
            title,
            brand,
            categoryPath,
            priceCurrent,
            priceOriginal,
            policy.currency(),
            availability,
            warranty,
            description,
            specifications,
            !specifications.isEmpty(),
            images,
            rating,
            null,
            runMetadata
        );
        return ExtractionResult.success(record, missing);
    }

    private String identifierFor(Element container, String sourceUrl) {
        String id = container.id();
        int dash = id.lastIndexOf('-');
        String nativeId = dash >= 0 ? id.substring(dash + 1).trim() : "";
        if (!nativeId.isEmpty()) {
            return nativeId;
        }
        return UrlCanonicalizer.canonicalize(sourceUrl);
    }

    private Optional<String> extractWarranty(Document document, Element container) {
        Element image = container.selectFirst(policy.warrantyImage());
        if (image != null) {
            String formatted = formatWarrantyLabel(image.attr("alt"));
            if (!formatted.isEmpty()) {
                return Optional.of(formatted);
            }
        }
        for (String line : textLines(document.body())) {
            if (line.toLowerCase(Locale.ROOT).contains(WARRANTY)) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    static String formatWarrantyLabel(String alt) {
        if (alt == null) {
            return "";
        }
        return alt.replaceAll("[-_]+", " ").replaceAll("\\s+", " ").trim();
    }

    private Map<String, String> extractSpecifications(Document document) {
        Map<String, String> specs = new LinkedHashMap<>();
        Element table = document.selectFirst(policy.specTable());
        if (table != null) {
            for (Element row : table.select("tr")) {
                Element header = row.selectFirst("th");
                Element value = row.selectFirst("td");
                if (header == null || value == null) {
                    continue;
                }
                String key = header.text().trim();
                if (!key.isEmpty()) {
                    specs.put(key, value.text().trim());
                }
            }
        }
        if (!specs.isEmpty()) {
            return specs;
        }
        Element block = document.selectFirst(policy.specBlock());
        if (block != null) {
            for (String line : textLines(block)) {
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                String key = line.substring(0, colon).trim();
                if (!key.isEmpty()) {
                    specs.put(key, line.substring(colon + 1).trim());
                }
            }
        }
        return specs;
    }

    /**
     * Text of {@code root} split into lines, where block elements and {@code <br>} end a line
     * even when the markup has no newlines. Works on a copy; the parsed document is not changed.
     */
    static List<String> textLines(Element root) {
        Element copy = root.clone();
        for (Element element : copy.select(LINE_BREAKING_TAGS)) {
            if (element != copy) {
                element.before(new TextNode("\n"));
                element.after(new TextNode("\n"));
            }
        }
        List<String> lines = new ArrayList<>();
        for (String line : copy.wholeText().split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private String orMissing(Optional<String> value, String field, List<String> missing) {
        if (value.isPresent()) {
            return value.get();
        }
        missing.add(field);
        return null;
    }
}
