package com.catalogcrawl.crawl.discovery;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.DiscoveryMode;
import com.catalogcrawl.crawl.model.DiscoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class UrlDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(UrlDiscoverer.class);

    private final Map<DiscoveryMode, UrlDiscoveryStrategy> strategies = new EnumMap<>(DiscoveryMode.class);
    private final CrawlerProperties properties;

    public UrlDiscoverer(List<UrlDiscoveryStrategy> strategies, CrawlerProperties properties) {
        for (UrlDiscoveryStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
        this.properties = properties;
    }

    public DiscoveryResult discover() {
        return discover(properties.getDiscovery().getMode());
    }

    public DiscoveryResult discover(DiscoveryMode mode) {
        UrlDiscoveryStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No discovery strategy registered for mode " + mode);
        }
        DiscoveryResult result = strategy.discover();
        log.info(
            "Discovery {} finished: reachable={}, sources={}, tasks={}, errors={}",
            mode,
            result.rootReachable(),
            result.sourcesFetched(),
            result.tasks().size(),
            result.errors()
        );
        return result;
    }
}
