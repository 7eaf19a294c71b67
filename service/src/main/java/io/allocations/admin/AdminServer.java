package io.allocations.admin;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.allocations.error.FailureSink;
import io.allocations.ledger.LedgerException;
import io.allocations.runtime.PassSummary;
import io.allocations.runtime.ReconciliationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Operator endpoints: pass status, metrics, on-demand passes and the tail of the failure log. All responses are
 * JSON.
 */
public class AdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);
    private static final int DEFAULT_ERROR_LIMIT = 10;

    private final HttpServer server;
    private final ExecutorService executor;
    private final ReconciliationDriver driver;
    private final MetricRegistry registry;
    private final FailureSink failures;

    public AdminServer(int port, ReconciliationDriver driver, MetricRegistry registry, FailureSink failures) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newCachedThreadPool();
        this.driver = driver;
        this.registry = registry;
        this.failures = failures;
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/reconcile", new ReconcileHandler());
        server.createContext("/errors", new ErrorsHandler());
        server.setExecutor(executor);
    }

    public void start() { server.start(); }

    /** The bound port, useful when constructed with port 0. */
    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void send(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private static boolean expect(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) return true;
        exchange.getResponseHeaders().add("Allow", method);
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return false;
    }

    private static String error(String message) {
        return "{\"error\":\"" + String.valueOf(message).replace("\\", "\\\\").replace("\"", "'") + "\"}";
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!expect(exchange, "GET")) return;
            String last = driver.lastPass().map(PassSummary::toJson).orElse("null");
            send(exchange, 200, "{\"running\":" + driver.isRunning() + ",\"lastPass\":" + last + "}");
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!expect(exchange, "GET")) return;
            send(exchange, 200, toJson());
        }

        private String toJson() {
            StringBuilder sb = new StringBuilder("{\"counters\":{");
            appendAll(sb, registry.getCounters(), (b, c) -> b.append(c.getCount()));
            sb.append("},\"meters\":{");
            appendAll(sb, registry.getMeters(), (b, m) -> b.append(String.format(Locale.ROOT,
                    "{\"count\":%d,\"rate1m\":%.4f}", m.getCount(), m.getOneMinuteRate())));
            sb.append("},\"timers\":{");
            appendAll(sb, registry.getTimers(), (b, t) -> {
                Snapshot s = t.getSnapshot();
                b.append(String.format(Locale.ROOT, "{\"count\":%d,\"meanMs\":%.2f,\"p95Ms\":%.2f,\"maxMs\":%.2f}",
                        t.getCount(), millis(s.getMean()), millis(s.get95thPercentile()), millis(s.getMax())));
            });
            return sb.append("}}").toString();
        }

        private <M> void appendAll(StringBuilder sb, Map<String, M> metrics, BiConsumer<StringBuilder, M> value) {
            boolean first = true;
            for (Map.Entry<String, M> e : metrics.entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append('"').append(e.getKey()).append("\":");
                value.accept(sb, e.getValue());
            }
        }

        private double millis(double nanos) { return nanos / TimeUnit.MILLISECONDS.toNanos(1); }
    }

    private class ReconcileHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!expect(exchange, "POST")) return;
            String path = exchange.getRequestURI().getPath();
            String cluster = path.length() > "/reconcile/".length() ? path.substring("/reconcile/".length()) : null;
            try {
                PassSummary summary = cluster == null ? driver.reconcileAll() : driver.reconcileCluster(cluster);
                send(exchange, 200, summary.toJson());
            } catch (IllegalArgumentException e) {
                send(exchange, 404, error(e.getMessage()));
            } catch (LedgerException e) {
                log.error("On-demand pass could not read the ledger", e);
                send(exchange, 503, error(e.getMessage()));
            }
        }
    }

    private class ErrorsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!expect(exchange, "GET")) return;
            int limit;
            try {
                limit = limit(exchange.getRequestURI().getRawQuery());
            } catch (NumberFormatException e) {
                send(exchange, 400, error("limit must be a number"));
                return;
            }
            List<String> lines = failures.recent(limit);
            send(exchange, 200, "{\"errors\":[" + String.join(",", lines) + "]}");
        }

        private int limit(String query) {
            if (query == null) return DEFAULT_ERROR_LIMIT;
            for (String param : query.split("&")) {
                if (param.startsWith("limit=")) return Math.max(0, Integer.parseInt(param.substring("limit=".length())));
            }
            return DEFAULT_ERROR_LIMIT;
        }
    }
}
