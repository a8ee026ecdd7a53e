package com.catalogcrawl.crawl.http;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherConcurrencyTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService workers;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (httpExecutor != null) {
            httpExecutor.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    @Test
    void neverExceedsConfiguredInFlightLimit() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                } finally {
                    active.decrementAndGet();
                }
                return new MockResponse().setResponseCode(200).setBody("page " + request.getPath());
            }
        });
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrentFetches(3);
        properties.setMaxRetries(0);
        properties.setRequestTimeoutSeconds(10);
        httpExecutor = Executors.newFixedThreadPool(6);
        workers = Executors.newFixedThreadPool(12);
        PageFetcher fetcher = new PageFetcher(properties, httpExecutor);

        List<CompletableFuture<HttpFetchResult>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String url = server.url("/product/" + i).toString();
            futures.add(CompletableFuture.supplyAsync(() -> fetcher.fetch(url), workers));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(futures).allSatisfy(future -> assertThat(future.join().isSuccessful()).isTrue());
        assertThat(server.getRequestCount()).isEqualTo(50);
        assertThat(peak.get()).isBetween(1, 3);
        assertThat(fetcher.peakInFlight()).isBetween(1, 3);
        assertThat(fetcher.inFlight()).isZero();
    }

    @Test
    void permitIsHeldAcrossRetriesAndBackoff() throws Exception {
        List<String> arrivals = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger hitsOnA = new AtomicInteger();
        CountDownLatch firstAttemptOnA = new CountDownLatch(1);
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                arrivals.add(request.getPath());
                if ("/a".equals(request.getPath()) && hitsOnA.incrementAndGet() == 1) {
                    firstAttemptOnA.countDown();
                    return new MockResponse().setResponseCode(500);
                }
                return new MockResponse().setResponseCode(200).setBody("ok");
            }
        });
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrentFetches(1);
        properties.setMaxRetries(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRetryBaseDelayMs(300);
        properties.setRetryMaxDelayMs(300);
        httpExecutor = Executors.newFixedThreadPool(2);
        workers = Executors.newFixedThreadPool(2);
        PageFetcher fetcher = new PageFetcher(properties, httpExecutor);

        CompletableFuture<HttpFetchResult> first = CompletableFuture.supplyAsync(
            () -> fetcher.fetch(server.url("/a").toString()), workers);
        assertThat(firstAttemptOnA.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<HttpFetchResult> second = CompletableFuture.supplyAsync(
            () -> fetcher.fetch(server.url("/b").toString()), workers);

        HttpFetchResult retried = first.get(10, TimeUnit.SECONDS);
        HttpFetchResult waited = second.get(10, TimeUnit.SECONDS);

        assertThat(retried.isSuccessful()).isTrue();
        assertThat(retried.attempts()).isEqualTo(2);
        assertThat(waited.isSuccessful()).isTrue();
        assertThat(arrivals).containsExactly("/a", "/a", "/b");
        assertThat(fetcher.peakInFlight()).isEqualTo(1);
    }
}
