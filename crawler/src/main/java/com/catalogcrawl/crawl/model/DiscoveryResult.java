package com.catalogcrawl.crawl.model;

import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    DiscoveryMode mode,
    boolean rootReachable,
    int sourcesFetched,
    List<CrawlTask> tasks,
    Map<String, Integer> errors
) {
    public static DiscoveryResult unreachable(DiscoveryMode mode, Map<String, Integer> errors) {
        return new DiscoveryResult(mode, false, 0, List.of(), errors);
    }
}
