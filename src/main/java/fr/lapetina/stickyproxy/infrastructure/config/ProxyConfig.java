package fr.lapetina.stickyproxy.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the proxy.
 * Designed to be populated from YAML; every section has working defaults.
 */
public class ProxyConfig {

    private ServerConfig server = new ServerConfig();
    private AdminConfig admin = new AdminConfig();
    private List<UpstreamConfig> upstreams = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private StickyConfig sticky = new StickyConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();
    private DiagnosticsConfig diagnostics = new DiagnosticsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public AdminConfig getAdmin() { return admin; }
    public void setAdmin(AdminConfig admin) { this.admin = admin; }

    public List<UpstreamConfig> getUpstreams() { return upstreams; }
    public void setUpstreams(List<UpstreamConfig> upstreams) { this.upstreams = upstreams; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public StickyConfig getSticky() { return sticky; }
    public void setSticky(StickyConfig sticky) { this.sticky = sticky; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public TelemetryConfig getTelemetry() { return telemetry; }
    public void setTelemetry(TelemetryConfig telemetry) { this.telemetry = telemetry; }

    public DiagnosticsConfig getDiagnostics() { return diagnostics; }
    public void setDiagnostics(DiagnosticsConfig diagnostics) { this.diagnostics = diagnostics; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Proxy listener configuration.
     */
    public static class ServerConfig {
        private String host = "0.0.0.0";
        private int port = 7000;
        private int maxContentLength = 10 * 1024 * 1024;
        private int ioThreads = 0;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getMaxContentLength() { return maxContentLength; }
        public void setMaxContentLength(int maxContentLength) { this.maxContentLength = maxContentLength; }

        /** Netty event loop threads, 0 for Netty's default. */
        public int getIoThreads() { return ioThreads; }
        public void setIoThreads(int ioThreads) { this.ioThreads = ioThreads; }
    }

    /**
     * Admin endpoint configuration.
     */
    public static class AdminConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 7001;
        private int backlog = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * One backend server.
     */
    public static class UpstreamConfig {
        private String url;

        public UpstreamConfig() {
        }

        public UpstreamConfig(String url) {
            this.url = url;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    public static class RoutingConfig {
        private String sessionParameter = "document_id";
        private int wsRoundRobinStep = 2;
        private int httpCursorResetValue = 0;

        public String getSessionParameter() { return sessionParameter; }
        public void setSessionParameter(String sessionParameter) { this.sessionParameter = sessionParameter; }

        public int getWsRoundRobinStep() { return wsRoundRobinStep; }
        public void setWsRoundRobinStep(int wsRoundRobinStep) { this.wsRoundRobinStep = wsRoundRobinStep; }

        public int getHttpCursorResetValue() { return httpCursorResetValue; }
        public void setHttpCursorResetValue(int httpCursorResetValue) { this.httpCursorResetValue = httpCursorResetValue; }
    }

    public static class StickyConfig {
        private int maxEntries = 10_000;
        private long idleTtlMs = 30 * 60 * 1000L;

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        /** 0 keeps sessions until evicted by size. */
        public long getIdleTtlMs() { return idleTtlMs; }
        public void setIdleTtlMs(long idleTtlMs) { this.idleTtlMs = idleTtlMs; }
    }

    public static class HealthCheckConfig {
        private long ttlMs = 1000;
        private long timeoutMs = 2000;

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class TimeoutsConfig {
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 0;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        /** 0 leaves forwarded requests unbounded. */
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    public static class TelemetryConfig {
        private boolean debug = false;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public boolean isDebug() { return debug; }
        public void setDebug(boolean debug) { this.debug = debug; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    public static class DiagnosticsConfig {
        private int responseSampleBytes = 1024;

        public int getResponseSampleBytes() { return responseSampleBytes; }
        public void setResponseSampleBytes(int responseSampleBytes) { this.responseSampleBytes = responseSampleBytes; }
    }

    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "sticky_proxy";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
