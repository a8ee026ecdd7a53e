package com.catalogcrawl.crawl.products;

import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;

import java.util.ArrayList;
import java.util.List;

/**
 * One location rule of a fallback chain, written as {@code css selector} (element text) or
 * {@code css selector@attribute}. The pseudo-attribute {@code html} selects inner HTML.
 * The selector is compiled up front so a bad policy fails at startup rather than per page.
 */
public final class FieldRule {
    static final String INNER_HTML = "html";

    private final String selector;
    private final String attribute;
    private final Evaluator evaluator;

    private FieldRule(String selector, String attribute) {
        this.selector = selector;
        this.attribute = attribute;
        this.evaluator = QueryParser.parse(selector);
    }

    public static FieldRule parse(String ruleText) {
        if (ruleText == null || ruleText.isBlank()) {
            throw new IllegalArgumentException("Empty extraction rule");
        }
        String trimmed = ruleText.trim();
        int at = trimmed.lastIndexOf('@');
        if (at > 0 && at > trimmed.lastIndexOf(']')) {
            String attribute = trimmed.substring(at + 1).trim();
            String selector = trimmed.substring(0, at).trim();
            if (attribute.isEmpty() || selector.isEmpty()) {
                throw new IllegalArgumentException("Malformed extraction rule: " + ruleText);
            }
            return new FieldRule(selector, attribute);
        }
        return new FieldRule(trimmed, null);
    }

    public String selector() {
        return selector;
    }

    public String attribute() {
        return attribute;
    }

    /**
     * Non-blank values of every match under {@code root}, in document order. With
     * {@code resolveUrls} attribute values are made absolute against the document base URI.
     */
    public List<String> values(Element root, boolean resolveUrls) {
        List<String> out = new ArrayList<>();
        for (Element element : root.select(evaluator)) {
            String value = valueOf(element, resolveUrls);
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private String valueOf(Element element, boolean resolveUrls) {
        if (attribute == null) {
            return element.text();
        }
        if (INNER_HTML.equals(attribute)) {
            return element.html();
        }
        if (!element.hasAttr(attribute)) {
            return null;
        }
        if (resolveUrls) {
            String absolute = element.absUrl(attribute);
            if (!absolute.isBlank()) {
                return absolute;
            }
        }
        return element.attr(attribute);
    }

    @Override
    public String toString() {
        return attribute == null ? selector : selector + "@" + attribute;
    }
}
