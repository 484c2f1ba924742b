package fr.lapetina.stickyproxy.domain.upstream;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.infrastructure.http.UpstreamHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * One backend server the balancer can forward to.
 *
 * Liveness is a TTL-cached probe of {@code GET {address}/health}. The whole
 * check-and-refresh sequence runs under a single lock, so at most one probe per
 * backend is in flight; callers arriving during a probe wait and reuse its result.
 */
public final class BackendUpstream implements Upstream {

    private static final Logger log = LoggerFactory.getLogger(BackendUpstream.class);

    private static final String HEALTH_PATH = "/health";

    private final String address;
    private final URI baseUri;
    private final URI healthUri;
    private final UpstreamHttpClient httpClient;
    private final long ttlNanos;
    private final Duration probeTimeout;
    private final LongSupplier nanoClock;

    private final Lock checkLock = new ReentrantLock();
    // Guarded by checkLock for writes; volatile so admin reads never block behind a probe
    private volatile boolean cachedAlive;
    private volatile long lastCheckedNanos;
    private volatile Instant lastCheckedAt;
    private volatile boolean everChecked;

    public BackendUpstream(String address, UpstreamHttpClient httpClient, Duration ttl, Duration probeTimeout) {
        this(address, httpClient, ttl, probeTimeout, System::nanoTime);
    }

    BackendUpstream(String address, UpstreamHttpClient httpClient, Duration ttl, Duration probeTimeout,
                    LongSupplier nanoClock) {
        this.address = Objects.requireNonNull(address, "Address is required");
        this.baseUri = parseAddress(address);
        this.healthUri = URI.create(stripTrailingSlash(baseUri.toString()) + HEALTH_PATH);
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        Objects.requireNonNull(ttl, "TTL is required");
        Objects.requireNonNull(probeTimeout, "Probe timeout is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Health check TTL must be positive, got " + ttl);
        }
        if (probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new IllegalArgumentException("Probe timeout must be positive, got " + probeTimeout);
        }
        this.ttlNanos = ttl.toNanos();
        this.probeTimeout = probeTimeout;
        this.nanoClock = nanoClock;
    }

    @Override
    public String getAddress() {
        return address;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public boolean isAlive() {
        checkLock.lock();
        try {
            long now = nanoClock.getAsLong();
            if (everChecked && now - lastCheckedNanos < ttlNanos) {
                return cachedAlive;
            }

            boolean alive = httpClient.probe(healthUri, probeTimeout);
            if (everChecked && alive != cachedAlive) {
                log.info("Upstream liveness changed: address={}, alive={}", address, alive);
            } else if (!everChecked && !alive) {
                log.info("Upstream not alive at first probe: address={}", address);
            }
            cachedAlive = alive;
            // Refreshed on failure too, so a dead backend is not re-probed before the TTL elapses
            lastCheckedNanos = nanoClock.getAsLong();
            lastCheckedAt = Instant.now();
            everChecked = true;
            return alive;
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Last probe result, without probing. False before the first probe.
     */
    public boolean cachedAlive() {
        return cachedAlive;
    }

    public Optional<Instant> lastCheckedAt() {
        return Optional.ofNullable(lastCheckedAt);
    }

    @Override
    public void serve(ProxyExchange exchange) throws IOException {
        ProxyRequest request = exchange.request();
        URI target = resolve(request.uri(), request.isWebSocketUpgrade());

        if (request.isWebSocketUpgrade()) {
            int status = exchange.tunnel(target);
            log.debug("WebSocket tunnel closed: address={}, handshakeStatus={}", address, status);
            return;
        }
        httpClient.forward(target, request, exchange.response());
    }

    /**
     * Joins the backend base address with the inbound request target.
     */
    URI resolve(String requestUri, boolean webSocket) {
        String base = stripTrailingSlash(baseUri.toString());
        if (webSocket) {
            // http -> ws, https -> wss
            base = "ws" + base.substring(4);
        }
        String path = requestUri.startsWith("/") ? requestUri : "/" + requestUri;
        return URI.create(base + path);
    }

    private static URI parseAddress(String address) {
        URI uri;
        try {
            uri = new URI(address.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUpstreamAddressException(address, e);
        }
        if (!uri.isAbsolute()) {
            throw new InvalidUpstreamAddressException(address, "address must be absolute");
        }
        String scheme = uri.getScheme().toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUpstreamAddressException(address, "unsupported scheme " + uri.getScheme());
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidUpstreamAddressException(address, "missing host");
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new InvalidUpstreamAddressException(address, "query and fragment are not allowed");
        }
        return uri;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return "BackendUpstream{" +
                "address='" + address + '\'' +
                ", cachedAlive=" + cachedAlive +
                ", lastCheckedAt=" + lastCheckedAt +
                '}';
    }
}
