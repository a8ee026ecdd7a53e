package com.catalogcrawl.crawl.discovery;

import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.model.DiscoveryResult;

/**
 * Produces the deduplicated product URLs for one run.
 * <p>
 * Implementations never throw for network trouble. An unreachable entry point comes back as a
 * result with {@code rootReachable=false} and no tasks.
 */
public interface UrlDiscoveryStrategy {

    DiscoveryMode mode();

    DiscoveryResult discover();
}
