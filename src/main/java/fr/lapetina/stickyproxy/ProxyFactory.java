package fr.lapetina.stickyproxy;

import fr.lapetina.stickyproxy.api.WebSocketTunnel;
import fr.lapetina.stickyproxy.disruptor.TelemetryPipeline;
import fr.lapetina.stickyproxy.disruptor.handlers.MetricsHandler;
import fr.lapetina.stickyproxy.domain.dispatch.Dispatcher;
import fr.lapetina.stickyproxy.domain.dispatch.ResponseSampler;
import fr.lapetina.stickyproxy.domain.dispatch.StickyTable;
import fr.lapetina.stickyproxy.domain.middleware.InterceptedUpstream;
import fr.lapetina.stickyproxy.domain.middleware.LoggingInterceptor;
import fr.lapetina.stickyproxy.domain.middleware.ServeObserver;
import fr.lapetina.stickyproxy.domain.middleware.TelemetryInterceptor;
import fr.lapetina.stickyproxy.domain.middleware.UpstreamInterceptor;
import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.upstream.BackendUpstream;
import fr.lapetina.stickyproxy.infrastructure.config.ConfigLoader;
import fr.lapetina.stickyproxy.infrastructure.config.ProxyConfig;
import fr.lapetina.stickyproxy.infrastructure.http.UpstreamHttpClient;
import fr.lapetina.stickyproxy.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds a fully-wired dispatcher and its collaborators from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ProxyFactory factory = ProxyFactory.create("config.yaml").start()) {
 *     Dispatcher dispatcher = factory.getDispatcher();
 *     // serve traffic...
 * }
 * }</pre>
 */
public class ProxyFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProxyFactory.class);

    private final ProxyConfig config;
    private final ConfigState configState;
    private final UpstreamHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;
    private final TelemetryPipeline telemetry;
    private final List<BackendUpstream> backends;
    private final Dispatcher dispatcher;
    private final WebSocketTunnel tunnel;

    protected ProxyFactory(ProxyConfig config, UpstreamHttpClient httpClientOverride) {
        this.config = ConfigLoader.validate(config);

        ProxyConfig.RoutingConfig routing = config.getRouting();
        this.configState = new ConfigState(
                routing.getWsRoundRobinStep(),
                routing.getHttpCursorResetValue(),
                config.getTelemetry().isDebug()
        );

        // Allow override for testing
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        if (config.getMetrics().isEnabled()) {
            this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
            this.telemetry = TelemetryPipeline.builder()
                    .ringBufferSize(config.getTelemetry().getRingBufferSize())
                    .waitStrategy(config.getTelemetry().getWaitStrategy())
                    .handler(new MetricsHandler(metricsRegistry))
                    .build();
        } else {
            this.metricsRegistry = null;
            this.telemetry = null;
        }
        ServeObserver observer = telemetry != null ? telemetry : ServeObserver.NONE;

        // Reference order: Logging(Telemetry(upstream))
        List<UpstreamInterceptor> interceptors = List.of(
                new LoggingInterceptor(configState),
                new TelemetryInterceptor(configState, observer)
        );

        Duration ttl = Duration.ofMillis(config.getHealthCheck().getTtlMs());
        Duration probeTimeout = Duration.ofMillis(config.getHealthCheck().getTimeoutMs());
        List<BackendUpstream> createdBackends = new ArrayList<>();
        List<InterceptedUpstream> upstreams = new ArrayList<>();
        for (ProxyConfig.UpstreamConfig upstreamConfig : config.getUpstreams()) {
            BackendUpstream backend = new BackendUpstream(upstreamConfig.getUrl().trim(), httpClient, ttl, probeTimeout);
            createdBackends.add(backend);
            upstreams.add(new InterceptedUpstream(backend, interceptors));
            log.debug("Registered upstream: {}", backend);
        }
        this.backends = Collections.unmodifiableList(createdBackends);

        StickyTable stickyTable = new StickyTable(
                config.getSticky().getMaxEntries(),
                Duration.ofMillis(config.getSticky().getIdleTtlMs())
        );
        ResponseSampler sampler = new ResponseSampler(config.getDiagnostics().getResponseSampleBytes());
        this.dispatcher = new Dispatcher(upstreams, configState, stickyTable, sampler,
                routing.getSessionParameter());

        this.tunnel = new WebSocketTunnel(
                (int) config.getTimeouts().getConnectTimeoutMs(),
                config.getTimeouts().getRequestTimeoutMs()
        );

        registerMetrics(stickyTable);

        log.info("ProxyFactory initialized: upstreams={}, {}", backends.size(), configState);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ProxyFactory create(String configPath) {
        log.info("Initializing ProxyFactory from config: {}", configPath);
        return new ProxyFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static ProxyFactory fromConfig(ProxyConfig config) {
        return new ProxyFactory(config, null);
    }

    /**
     * Starts the telemetry pipeline.
     */
    public ProxyFactory start() {
        if (telemetry != null) {
            telemetry.start();
        }
        return this;
    }

    public ProxyConfig getConfig() {
        return config;
    }

    public ConfigState getConfigState() {
        return configState;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public WebSocketTunnel getTunnel() {
        return tunnel;
    }

    /**
     * Null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Null when metrics are disabled.
     */
    public TelemetryPipeline getTelemetry() {
        return telemetry;
    }

    private UpstreamHttpClient createHttpClient() {
        long requestTimeoutMs = config.getTimeouts().getRequestTimeoutMs();
        return new UpstreamHttpClient(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                requestTimeoutMs > 0 ? Duration.ofMillis(requestTimeoutMs) : null
        );
    }

    private void registerMetrics(StickyTable stickyTable) {
        if (metricsRegistry == null) {
            return;
        }
        metricsRegistry.registerGauge("forwarded_requests", "Requests forwarded since start",
                configState::getGlobalCounter);
        metricsRegistry.registerGauge("sticky_sessions", "Sessions in the sticky table", stickyTable::size);
        metricsRegistry.registerGauge("telemetry_dropped", "Telemetry events dropped on a full ring buffer",
                telemetry::getDroppedCount);
        for (BackendUpstream backend : backends) {
            metricsRegistry.registerUpstreamAlive(backend.getAddress(), backend::cachedAlive);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down ProxyFactory...");

        if (telemetry != null) {
            try {
                telemetry.close();
            } catch (Exception e) {
                log.warn("Error closing telemetry pipeline", e);
            }
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("ProxyFactory shut down");
    }
}
