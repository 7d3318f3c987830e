package io.xrelay.feed;

import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls candidates from every configured feed concurrently and merges them. Results are cached
 * for the refresh interval; a non-empty cached list inside that interval is returned without any
 * network call.
 */
public final class RelaySourceAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(RelaySourceAggregator.class);
    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    private final List<RelaySource> sources;
    private final long feedTimeoutMs;
    private final long cacheMs;
    private final HttpClient http;

    private List<RawCandidate> cached = List.of();
    private long lastFetchMs;
    private List<FeedFetchResult> lastResults = List.of();

    public RelaySourceAggregator(List<RelaySource> sources, long feedTimeoutMs, long cacheMs) {
        this(sources, feedTimeoutMs, cacheMs, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(feedTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public RelaySourceAggregator(List<RelaySource> sources, long feedTimeoutMs, long cacheMs, HttpClient http) {
        if (feedTimeoutMs <= 0L) {
            throw new IllegalArgumentException("feedTimeoutMs must be > 0");
        }
        this.sources = List.copyOf(sources);
        this.feedTimeoutMs = feedTimeoutMs;
        this.cacheMs = Math.max(0L, cacheMs);
        this.http = http;
    }

    public List<RawCandidate> fetchCandidates() {
        return fetchCandidates(System.currentTimeMillis());
    }

    public synchronized List<RawCandidate> fetchCandidates(long nowMs) {
        if (!cached.isEmpty() && nowMs - lastFetchMs < cacheMs) {
            LOG.debug("Using {} cached relay candidates", cached.size());
            return cached;
        }
        List<FeedFetchResult> results = fetchAll();
        List<RawCandidate> merged = merge(results);
        cached = merged;
        lastFetchMs = nowMs;
        lastResults = results;
        LOG.info("Fetched {} unique relay candidates from {} feeds", merged.size(), results.size());
        return merged;
    }

    /** Drops the cached list so the next fetch goes to the network. */
    public synchronized void invalidate() {
        cached = List.of();
        lastFetchMs = 0L;
    }

    public synchronized List<FeedFetchResult> lastResults() {
        return lastResults;
    }

    public synchronized long lastFetchMs() {
        return lastFetchMs;
    }

    /** Fetches every feed once, bypassing the cache. Never throws for feed failures. */
    public List<FeedFetchResult> fetchAll() {
        List<CompletableFuture<FeedFetchResult>> futures = new ArrayList<>();
        for (RelaySource source : sources) {
            futures.add(fetchOne(source));
        }
        List<FeedFetchResult> out = new ArrayList<>();
        for (CompletableFuture<FeedFetchResult> future : futures) {
            out.add(future.join());
        }
        return out;
    }

    /** Deduplicates by address and port; the first source to report an address keeps it. */
    static List<RawCandidate> merge(List<FeedFetchResult> results) {
        Map<RelayKey, RawCandidate> unique = new LinkedHashMap<>();
        for (FeedFetchResult result : results) {
            for (RawCandidate candidate : result.candidates()) {
                RelayKey key;
                try {
                    key = candidate.key();
                } catch (IllegalArgumentException e) {
                    continue;
                }
                unique.putIfAbsent(key, candidate);
            }
        }
        return List.copyOf(unique.values());
    }

    private CompletableFuture<FeedFetchResult> fetchOne(RelaySource source) {
        long started = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(source.url()))
                    .timeout(Duration.ofMillis(feedTimeoutMs))
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(failed(source, "invalid url: " + e.getMessage(), started));
        }
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .orTimeout(feedTimeoutMs, TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return failed(source, describe(error), started);
                    }
                    if (response.statusCode() / 100 != 2) {
                        return failed(source, "HTTP " + response.statusCode(), started);
                    }
                    List<RawCandidate> parsed = FeedParser.parse(source, response.body());
                    LOG.debug("Feed {} returned {} candidates", source.name(), parsed.size());
                    return FeedFetchResult.ok(source.name(), parsed, elapsedMs(started));
                });
    }

    private static FeedFetchResult failed(RelaySource source, String reason, long started) {
        LOG.warn("Relay feed {} failed: {}", source.name(), reason);
        return FeedFetchResult.failed(source.name(), reason, elapsedMs(started));
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return "timeout";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
