package com.catalogcrawl.crawl.products;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ordered fallback rules for one field. The first rule that yields a non-blank value wins.
 */
public final class SelectorChain {
    private final List<FieldRule> rules;

    private SelectorChain(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SelectorChain of(List<String> ruleTexts) {
        if (ruleTexts == null) {
            return new SelectorChain(List.of());
        }
        return new SelectorChain(ruleTexts.stream()
            .filter(ruleText -> ruleText != null && !ruleText.isBlank())
            .map(FieldRule::parse)
            .toList());
    }

    public static SelectorChain of(String... ruleTexts) {
        return of(List.of(ruleTexts));
    }

    public List<FieldRule> rules() {
        return rules;
    }

    public Optional<String> first(Element root) {
        return first(root, UnaryOperator.identity());
    }

    /**
     * Like {@link #first(Element)}, but a candidate that normalizes to blank does not count as a
     * match and the next candidate is tried.
     */
    public Optional<String> first(Element root, UnaryOperator<String> normalizer) {
        for (FieldRule rule : rules) {
            for (String value : rule.values(root, false)) {
                String normalized = normalizer.apply(value);
                if (normalized != null && !normalized.isBlank()) {
                    return Optional.of(normalized);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> all(Element root) {
        return all(root, false);
    }

    public List<String> allUrls(Element root) {
        return all(root, true);
    }

    private List<String> all(Element root, boolean resolveUrls) {
        for (FieldRule rule : rules) {
            List<String> values = rule.values(root, resolveUrls);
            if (!values.isEmpty()) {
                return values;
            }
        }
        return List.of();
    }
}
