package io.xrelay.cli;

import com.sun.net.httpserver.HttpServer;
import io.xrelay.config.XRelayConfig;
import io.xrelay.dispatch.DispatchMode;
import io.xrelay.dispatch.DispatchPolicy;
import io.xrelay.dispatch.DispatchResult;
import io.xrelay.dispatch.OutboundRequest;
import io.xrelay.gateway.GatewayHandler;
import io.xrelay.runtime.XRelayRuntime;
import io.xrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "xrelay",
        mixinStandardHelpOptions = true,
        description = "Rotating relay pool and request dispatcher",
        subcommands = {
                XRelayCommand.InitCommand.class,
                XRelayCommand.RefreshCommand.class,
                XRelayCommand.StatusCommand.class,
                XRelayCommand.SampleCommand.class,
                XRelayCommand.DispatchCommand.class,
                XRelayCommand.SweepCommand.class,
                XRelayCommand.ServeCommand.class,
                XRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class XRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--db"}, description = "JDBC URL of the durable relay store (default: $"
            + XRelayConfig.DATABASE_URL_ENV + "; volatile store when unset)")
    String databaseUrl;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | refresh | status | sample | dispatch | sweep | serve | schema-migrations");
    }

    XRelayConfig config() {
        return XRelayConfig.fromRoot(root, XRelayConfig.resolveDatabaseUrl(databaseUrl));
    }

    XRelayRuntime runtime() {
        XRelayRuntime runtime = new XRelayRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the runtime root and, when configured, the relay schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                System.out.println("Initialized xrelay at: " + runtime.config().rootDir()
                        + " (store=" + runtime.mode().label() + ")");
            }
            return 0;
        }
    }

    @Command(name = "refresh", description = "Refill the relay pool from the configured feeds")
    static final class RefreshCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--force"}, defaultValue = "true", description = "Refill even if the pool looks sufficient")
        boolean force;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.refresh(force)));
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Show pool size, mode and deprecation statistics")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("pool", runtime.poolStatus());
                out.put("deprecated", runtime.deprecatedStats());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "sample", description = "Draw relays from the pool, weighted by success rate")
    static final class SampleCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--count"}, defaultValue = "1", description = "Relays to draw")
        int count;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.getRelayBatch(count)));
            }
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Send one request through the relay pool")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--url"}, required = true, description = "Target URL")
        String url;

        @Option(names = {"--method"}, defaultValue = "GET", description = "HTTP method")
        String method;

        @Option(names = {"--header"}, description = "Request header name=value (repeatable)")
        Map<String, String> headers;

        @Option(names = {"--body"}, description = "Request body for POST, PUT and PATCH")
        String body;

        @Option(names = {"--mode"}, defaultValue = "sequential", description = "sequential | parallel")
        String mode;

        @Option(names = {"--no-fallback"}, defaultValue = "false", description = "Fail instead of sending directly")
        boolean noFallback;

        @Option(names = {"--max-attempts"}, defaultValue = "-1", description = "Relay attempts (-1 uses settings)")
        int maxAttempts;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                DispatchPolicy policy = runtime.defaultPolicy().withMode(DispatchMode.fromString(mode));
                if (noFallback) {
                    policy = policy.withUseFallback(false);
                }
                if (maxAttempts >= 0) {
                    policy = policy.withMaxAttempts(maxAttempts);
                }
                DispatchResult result = runtime.dispatch(new OutboundRequest(url, method, headers, body), policy);
                runtime.awaitPendingReports(policy.relayTimeoutMs() + policy.probeTimeoutMs());
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "sweep", description = "Delete deprecated relays past the retention window")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--retention-days"}, defaultValue = "-1", description = "Retention in days (-1 uses settings)")
        int retentionDays;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(retentionDays < 0 ? runtime.sweep() : runtime.sweep(retentionDays)));
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP gateway (POST /relay, GET /status, GET /metrics)")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--bind"}, defaultValue = "127.0.0.1", description = "Bind host")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8787", description = "Bind port")
        int port;

        @Override
        public Integer call() throws Exception {
            XRelayRuntime runtime = parent.runtime();
            GatewayHandler gateway = new GatewayHandler(runtime);
            HttpServer server = HttpServer.create(new InetSocketAddress(bind, port), 0);
            gateway.install(server);
            server.setExecutor(Executors.newFixedThreadPool(8));
            ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor();
            housekeeping.scheduleAtFixedRate(gateway::cleanupExpired, 5L, 5L, TimeUnit.MINUTES);
            runtime.startMaintenance();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(1);
                housekeeping.shutdownNow();
                runtime.close();
            }));
            server.start();
            System.out.println("xrelay gateway listening on http://" + bind + ":" + port + "/relay, store=" + runtime.mode().label());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations of the durable store")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        XRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (XRelayRuntime runtime = parent.runtime()) {
                List<?> rows = runtime.listSchemaMigrations(limit);
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }
}
