package com.catalogcrawl.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlCanonicalizer {
    private static final Set<String> TRACKING_PARAMETERS = Set.of("fbclid", "gclid", "msclkid");

    private UrlCanonicalizer() {
    }

    /**
     * Lower-cases scheme and host, drops default ports, fragment and trailing slashes. The query
     * is kept without tracking parameters ({@code utm_*}, click ids), with the remaining
     * parameters sorted. Input that does not parse as an absolute URL is returned trimmed.
     */
    public static String canonicalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = canonicalQuery(uri.getRawQuery());
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path
            + (query.isEmpty() ? "" : "?" + query);
    }

    static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String parameter : rawQuery.split("&")) {
            if (parameter.isEmpty()) {
                continue;
            }
            int equals = parameter.indexOf('=');
            String name = (equals >= 0 ? parameter.substring(0, equals) : parameter).toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMETERS.contains(name)) {
                continue;
            }
            kept.add(parameter);
        }
        kept.sort(null);
        return String.join("&", kept);
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
