package fr.lapetina.stickyproxy.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.stickyproxy.disruptor.TelemetryPipeline;
import fr.lapetina.stickyproxy.domain.dispatch.Dispatcher;
import fr.lapetina.stickyproxy.domain.dispatch.ResponseSampler;
import fr.lapetina.stickyproxy.domain.dispatch.StickyTable;
import fr.lapetina.stickyproxy.domain.middleware.InterceptedUpstream;
import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.BackendUpstream;
import fr.lapetina.stickyproxy.domain.upstream.Upstream;
import fr.lapetina.stickyproxy.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lightweight admin server using JDK's built-in HttpServer.
 *
 * Endpoints (GET only):
 * - /health - 200 UP when any upstream was last seen alive, 503 DOWN otherwise
 * - /metrics - Prometheus metrics endpoint
 * - /admin/upstreams - upstream liveness and the round-robin cursors
 * - /admin/sticky?session=ID - sticky table size and a session's upstream
 * - /admin/stats - forwarded request counter and routing tunables
 * - /admin/sample - the last sampled response body
 *
 * Nothing here triggers a health probe; liveness is read from the cache.
 */
public final class AdminServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Dispatcher dispatcher;
    private final MetricsRegistry metricsRegistry;
    private final TelemetryPipeline telemetry;

    public AdminServer(
            String host,
            int port,
            int backlog,
            Dispatcher dispatcher,
            MetricsRegistry metricsRegistry,
            TelemetryPipeline telemetry
    ) throws IOException {
        this.dispatcher = dispatcher;
        this.metricsRegistry = metricsRegistry;
        this.telemetry = telemetry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "admin-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", get(this::handleHealth));
        server.createContext("/metrics", get(this::handleMetrics));
        server.createContext("/admin", get(this::handleAdmin));
        server.createContext("/", get(exchange -> sendError(exchange, 404, "Not Found")));

        log.info("Admin server configured: host={}, port={}", host, port);
    }

    public void start() {
        server.start();
        log.info("Admin server started: port={}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Admin server stopped");
    }

    // ==================== HANDLERS ====================

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"/health".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "Not Found");
            return;
        }
        long alive = dispatcher.getUpstreams().stream()
                .map(AdminServer::backendOf)
                .filter(b -> b.map(BackendUpstream::cachedAlive).orElse(false))
                .count();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", alive > 0 ? "UP" : "DOWN");
        health.put("aliveUpstreams", alive);
        health.put("totalUpstreams", dispatcher.getUpstreams().size());
        sendJson(exchange, alive > 0 ? 200 : 503, health);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (metricsRegistry == null) {
            sendError(exchange, 404, "Metrics disabled");
            return;
        }
        byte[] bytes = metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void handleAdmin(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        switch (path) {
            case "/admin/upstreams" -> handleUpstreams(exchange);
            case "/admin/sticky" -> handleSticky(exchange);
            case "/admin/stats" -> handleStats(exchange);
            case "/admin/sample" -> handleSample(exchange);
            default -> sendError(exchange, 404, "Not Found");
        }
    }

    private void handleUpstreams(HttpExchange exchange) throws IOException {
        List<Map<String, Object>> upstreams = new ArrayList<>();
        int position = 0;
        for (Upstream upstream : dispatcher.getUpstreams()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("position", position++);
            info.put("address", upstream.getAddress());
            Optional<BackendUpstream> backend = backendOf(upstream);
            info.put("alive", backend.map(BackendUpstream::cachedAlive).orElse(null));
            info.put("lastCheckedAt", backend.flatMap(BackendUpstream::lastCheckedAt).orElse(null));
            upstreams.add(info);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("upstreams", upstreams);
        body.put("httpCursor", dispatcher.httpCursor());
        body.put("wsCursor", dispatcher.wsCursor());
        sendJson(exchange, 200, body);
    }

    private void handleSticky(HttpExchange exchange) throws IOException {
        StickyTable table = dispatcher.getStickyTable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", table.size());
        body.put("evictions", table.getEvictions());

        Optional<String> session = queryParameter(exchange, "session");
        if (session.isPresent()) {
            Optional<StickyTable.Association> association = table.peek(session.get().trim());
            if (association.isEmpty()) {
                sendError(exchange, 404, "No sticky route for session: " + session.get());
                return;
            }
            body.put("session", session.get().trim());
            body.put("upstream", association.get().address());
            body.put("token", association.get().token().toString());
        }
        sendJson(exchange, 200, body);
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        ConfigState state = dispatcher.getConfigState();
        ConfigState.Tunables tunables = state.getTunables();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("globalRequestCounter", state.getGlobalCounter());
        body.put("wsRoundRobinStep", tunables.wsStep());
        body.put("httpCursorResetValue", tunables.httpResetValue());
        body.put("debugMode", state.isDebugMode());
        body.put("sessionParameter", dispatcher.getSessionParameter());
        if (telemetry != null) {
            Map<String, Object> pipeline = new LinkedHashMap<>();
            pipeline.put("published", telemetry.getPublishedCount());
            pipeline.put("dropped", telemetry.getDroppedCount());
            pipeline.put("remainingCapacity", telemetry.getRemainingCapacity());
            body.put("telemetry", pipeline);
        }
        sendJson(exchange, 200, body);
    }

    private void handleSample(HttpExchange exchange) throws IOException {
        ResponseSampler sampler = dispatcher.getSampler();
        if (!sampler.isEnabled()) {
            sendError(exchange, 404, "Response sampling disabled");
            return;
        }
        Optional<ResponseSampler.Sample> sample = sampler.lastSample();
        if (sample.isEmpty()) {
            sendError(exchange, 404, "No response sampled yet");
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", sample.get().status());
        body.put("capturedAt", sample.get().capturedAt());
        body.put("truncated", sample.get().truncated());
        body.put("maxBytes", sampler.getMaxBytes());
        body.put("sampledResponses", sampler.getSampledCount());
        body.put("body", sample.get().bodyText());
        sendJson(exchange, 200, body);
    }

    // ==================== HELPER METHODS ====================

    private static Optional<BackendUpstream> backendOf(Upstream upstream) {
        Upstream current = upstream;
        while (current instanceof InterceptedUpstream) {
            current = ((InterceptedUpstream) current).unwrap();
        }
        return current instanceof BackendUpstream ? Optional.of((BackendUpstream) current) : Optional.empty();
    }

    private static Optional<String> queryParameter(HttpExchange exchange, String name) {
        return ProxyRequest.queryParameter(exchange.getRequestURI().toString(), name)
                .filter(value -> !value.isBlank());
    }

    private HttpHandler get(AdminHandler handler) {
        return exchange -> {
            MDC.put("requestId", UUID.randomUUID().toString());
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                handler.handle(exchange);
            } catch (IOException e) {
                log.warn("Admin response failed: path={}, error={}", exchange.getRequestURI().getPath(), e.toString());
                throw e;
            } catch (RuntimeException e) {
                log.error("Error in admin handler: path={}", exchange.getRequestURI().getPath(), e);
                sendError(exchange, 500, String.valueOf(e.getMessage()));
            } finally {
                exchange.close();
                MDC.remove("requestId");
            }
        };
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }

    @FunctionalInterface
    private interface AdminHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
