package io.xrelay.feed;

import io.xrelay.model.RawCandidate;

import java.util.List;

/**
 * Outcome of fetching one feed. A failed feed carries no candidates and a reason; it is merged
 * like any other result.
 */
public record FeedFetchResult(String source, List<RawCandidate> candidates, String error, long elapsedMs) {
    public FeedFetchResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static FeedFetchResult ok(String source, List<RawCandidate> candidates, long elapsedMs) {
        return new FeedFetchResult(source, candidates, null, elapsedMs);
    }

    public static FeedFetchResult failed(String source, String reason, long elapsedMs) {
        return new FeedFetchResult(source, List.of(), reason == null ? "unknown" : reason, elapsedMs);
    }

    public boolean succeeded() {
        return error == null;
    }
}
