package com.catalogcrawl.crawl.util;

import java.util.regex.Pattern;

/**
 * Turns display prices such as {@code "Rs. 125,000.00"} into plain decimal strings
 * ({@code "125000.00"}). The result is either empty or digits with at most one decimal point,
 * and normalizing it again returns the same string.
 */
public final class PriceNormalizer {
    private static final Pattern NON_PRICE_CHARS = Pattern.compile("[^0-9.]");

    private PriceNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String kept = NON_PRICE_CHARS.matcher(raw).replaceAll("");
        int start = 0;
        int end = kept.length();
        while (start < end && kept.charAt(start) == '.') {
            start++;
        }
        while (end > start && kept.charAt(end - 1) == '.') {
            end--;
        }
        kept = kept.substring(start, end);

        // only the last point is the decimal separator
        int lastDot = kept.lastIndexOf('.');
        if (lastDot < 0) {
            return kept;
        }
        return kept.substring(0, lastDot).replace(".", "") + kept.substring(lastDot);
    }
}
