package com.catalogcrawl.crawl.http;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GET client shared by discovery and the product workers.
 * <p>
 * A global semaphore caps the number of tasks talking to the network. The permit is taken once
 * per {@link #fetch} call and held across every attempt and backoff sleep of that call, so a
 * host that keeps failing holds its slot until retries run out. Callers never see an exception:
 * failures come back as an {@link HttpFetchResult} with an error code or a non-2xx status.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    public static final String XML_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public PageFetcher(CrawlerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getMaxConcurrentFetches());
    }

    public HttpFetchResult fetch(String url) {
        return fetch(url, HTML_ACCEPT);
    }

    public HttpFetchResult fetch(String url, String acceptHeader) {
        return send(url, acceptHeader, false);
    }

    /**
     * Fetch for listing pages where 404 marks the end of a sequence: a 404 is returned after a
     * single attempt instead of being retried.
     */
    public HttpFetchResult fetchListing(String url) {
        return send(url, HTML_ACCEPT, true);
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    private HttpFetchResult send(String url, String acceptHeader, boolean notFoundIsTerminal) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, 0, "invalid_url", "URL missing host or malformed");
        }

        try {
            globalLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, 0, "interrupted", e.getMessage());
        }
        try {
            int maxAttempts = 1 + properties.getMaxRetries();
            HttpFetchResult lastResult = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1 && !sleepBackoff(attempt - 1)) {
                    break;
                }
                lastResult = executeOnce(url, uri, acceptHeader, attempt);
                if (!shouldRetry(lastResult, notFoundIsTerminal)) {
                    break;
                }
                if (attempt < maxAttempts) {
                    log.debug("Retrying {} after {} (attempt {}/{})", url, lastResult.failureKey(), attempt, maxAttempts);
                }
            }
            if (lastResult != null && !lastResult.isSuccessful() && !lastResult.isNotFound()) {
                log.debug("Giving up on {} after {} attempt(s): {}", url, lastResult.attempts(), lastResult.failureKey());
            }
            return lastResult;
        } finally {
            globalLimiter.release();
        }
    }

    private HttpFetchResult executeOnce(String url, URI uri, String acceptHeader, int attempt) {
        Instant startedAt = Instant.now();
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, attempt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, attempt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, attempt, "http_error", e.getMessage());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private boolean shouldRetry(HttpFetchResult result, boolean notFoundIsTerminal) {
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        if (status == 404 && notFoundIsTerminal) {
            return false;
        }
        return status >= 400;
    }

    /**
     * Delay before retry number {@code retry} (1-based): {@code 2^(retry-1) * base}, capped when a
     * positive max is configured.
     */
    static long backoffDelayMs(int retry, int baseDelayMs, int maxDelayMs) {
        if (retry <= 0 || baseDelayMs <= 0) {
            return 0L;
        }
        int shift = Math.min(30, retry - 1);
        long delay = (long) baseDelayMs * (1L << shift);
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    private boolean sleepBackoff(int retry) {
        long delay = backoffDelayMs(retry, properties.getRetryBaseDelayMs(), properties.getRetryMaxDelayMs());
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, int attempt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            attempt,
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
