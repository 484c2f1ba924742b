package fr.lapetina.stickyproxy.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Forwarded request counters per upstream and outcome
 * - Serve latency timers per upstream
 * - Liveness, sticky table and telemetry gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized: prefix={}", prefix);
    }

    public MetricsRegistry() {
        this("sticky_proxy");
    }

    public String getPrefix() {
        return prefix;
    }

    public void incrementRequestCount(String upstream, String outcome) {
        String key = upstream + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_upstream_requests_total")
                        .description("Requests forwarded to an upstream")
                        .tag("upstream", upstream)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records serve duration. WebSocket tunnels are timed separately since they
     * measure connection lifetime rather than request latency.
     */
    public void recordLatency(String upstream, boolean webSocket, Duration latency) {
        String kind = webSocket ? "websocket" : "http";
        String key = upstream + ":" + kind;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_upstream_latency")
                        .description("Time spent serving through an upstream")
                        .tag("upstream", upstream)
                        .tag("kind", kind)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a gauge reporting an upstream's cached liveness (1 alive, 0 dead).
     */
    public void registerUpstreamAlive(String upstream, Supplier<Boolean> alive) {
        Gauge.builder(prefix + "_upstream_alive", () -> alive.get() ? 1 : 0)
                .description("Cached upstream liveness (1=alive, 0=dead)")
                .tag("upstream", upstream)
                .register(registry);
    }

    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(prefix + "_" + name, value)
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
