package io.xrelay.feed;

import com.sun.net.httpserver.HttpServer;
import io.xrelay.model.RawCandidate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

final class RelaySourceAggregatorTest {

    @Test
    void mergesFeedsFirstSourceWinsAndToleratesFailures() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond(server, "/a", 200, "1.1.1.1:80\n2.2.2.2:8080\n");
        respond(server, "/b", 200, "2.2.2.2:8080\n3.3.3.3:3128\n");
        respond(server, "/broken", 500, "oops");
        server.start();
        try {
            String base = "http://127.0.0.1:" + server.getAddress().getPort();
            RelaySourceAggregator aggregator = new RelaySourceAggregator(List.of(
                    new RelaySource("a", base + "/a", FeedFormat.LINES),
                    new RelaySource("broken", base + "/broken", FeedFormat.LINES),
                    new RelaySource("b", base + "/b", FeedFormat.LINES)
            ), 2_000L, 60_000L);

            List<RawCandidate> merged = aggregator.fetchCandidates(1_000L);
            Assertions.assertEquals(List.of(
                    new RawCandidate("1.1.1.1", 80, "a"),
                    new RawCandidate("2.2.2.2", 8080, "a"),
                    new RawCandidate("3.3.3.3", 3128, "b")
            ), merged);

            List<FeedFetchResult> results = aggregator.lastResults();
            Assertions.assertEquals(3, results.size());
            Assertions.assertFalse(results.get(1).succeeded());
            Assertions.assertEquals("HTTP 500", results.get(1).error());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void cachedCandidatesAreReusedUntilExpiryOrInvalidation() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/feed", exchange -> {
            hits.incrementAndGet();
            byte[] bytes = "4.4.4.4:80\n".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        try {
            String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/feed";
            RelaySourceAggregator aggregator = new RelaySourceAggregator(
                    List.of(new RelaySource("only", url, FeedFormat.LINES)), 2_000L, 10_000L);

            aggregator.fetchCandidates(1_000L);
            aggregator.fetchCandidates(5_000L);
            Assertions.assertEquals(1, hits.get());

            aggregator.fetchCandidates(11_001L);
            Assertions.assertEquals(2, hits.get());

            aggregator.invalidate();
            aggregator.fetchCandidates(11_002L);
            Assertions.assertEquals(3, hits.get());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void slowFeedTimesOutWithoutFailingTheRest() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        ExecutorService handlers = Executors.newFixedThreadPool(4);
        server.setExecutor(handlers);
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        respond(server, "/fast", 200, "5.5.5.5:80\n");
        server.start();
        try {
            String base = "http://127.0.0.1:" + server.getAddress().getPort();
            RelaySourceAggregator aggregator = new RelaySourceAggregator(List.of(
                    new RelaySource("slow", base + "/slow", FeedFormat.LINES),
                    new RelaySource("fast", base + "/fast", FeedFormat.LINES)
            ), 300L, 0L);

            List<FeedFetchResult> results = aggregator.fetchAll();
            Assertions.assertFalse(results.get(0).succeeded());
            Assertions.assertEquals("timeout", results.get(0).error());
            Assertions.assertEquals(List.of(new RawCandidate("5.5.5.5", 80, "fast")), results.get(1).candidates());
        } finally {
            server.stop(0);
            handlers.shutdownNow();
        }
    }

    @Test
    void emptyResultIsNotCached() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/empty", exchange -> {
            hits.incrementAndGet();
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        try {
            String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/empty";
            RelaySourceAggregator aggregator = new RelaySourceAggregator(
                    List.of(new RelaySource("empty", url, FeedFormat.LINES)), 2_000L, 60_000L);
            Assertions.assertTrue(aggregator.fetchCandidates(1_000L).isEmpty());
            Assertions.assertTrue(aggregator.fetchCandidates(1_001L).isEmpty());
            Assertions.assertEquals(2, hits.get());
        } finally {
            server.stop(0);
        }
    }

    private static void respond(HttpServer server, String path, int status, String body) {
        server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            } catch (IOException ignored) {
                // client went away
            }
        });
    }
}
