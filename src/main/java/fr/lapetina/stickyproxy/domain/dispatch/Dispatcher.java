package fr.lapetina.stickyproxy.domain.dispatch;

import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;
import fr.lapetina.stickyproxy.domain.upstream.Upstream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The load balancer: picks an upstream for every inbound request.
 *
 * Two independent round-robin cursors, one for plain HTTP and one for WebSocket
 * upgrades, plus a sticky table that pins a session id to the upstream that
 * first served it. A pinned upstream that stops being alive is replaced on the
 * next routing for that session.
 *
 * Locking:
 * - the dispatch lock covers cursor read, scan and advance as one unit;
 * - the sticky table has its own lock;
 * - response sampling has its own lock.
 * No two of them are ever held together.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    public static final String DEFAULT_SESSION_PARAMETER = "document_id";

    private final List<Upstream> upstreams;
    private final Map<String, Upstream> byAddress;
    private final ConfigState configState;
    private final StickyTable stickyTable;
    private final ResponseSampler sampler;
    private final String sessionParameter;

    private final Lock dispatchLock = new ReentrantLock();
    // Guarded by dispatchLock
    private int httpCursor;
    private int wsCursor;

    public Dispatcher(List<? extends Upstream> upstreams, ConfigState configState, StickyTable stickyTable,
                      ResponseSampler sampler, String sessionParameter) {
        Objects.requireNonNull(upstreams, "Upstreams are required");
        if (upstreams.isEmpty()) {
            throw new IllegalArgumentException("At least one upstream is required");
        }
        this.upstreams = List.copyOf(upstreams);
        this.configState = Objects.requireNonNull(configState, "ConfigState is required");
        this.stickyTable = Objects.requireNonNull(stickyTable, "StickyTable is required");
        this.sampler = sampler != null ? sampler : ResponseSampler.disabled();
        this.sessionParameter = Objects.requireNonNull(sessionParameter, "Session parameter is required");

        int resetValue = configState.getTunables().httpResetValue();
        if (resetValue >= this.upstreams.size()) {
            throw new IllegalArgumentException("httpCursorResetValue " + resetValue
                    + " is outside [0, " + this.upstreams.size() + ")");
        }

        Map<String, Upstream> index = new HashMap<>();
        for (Upstream upstream : this.upstreams) {
            if (index.putIfAbsent(upstream.getAddress(), upstream) != null) {
                throw new IllegalArgumentException("Duplicate upstream address: " + upstream.getAddress());
            }
        }
        this.byAddress = Map.copyOf(index);

        log.info("Dispatcher created: upstreams={}, tunables={}, sessionParameter={}",
                this.upstreams.size(), configState.getTunables(), sessionParameter);
    }

    public Dispatcher(List<? extends Upstream> upstreams, ConfigState configState) {
        this(upstreams, configState, StickyTable.unbounded(), ResponseSampler.disabled(),
                DEFAULT_SESSION_PARAMETER);
    }

    /**
     * Returns the first alive upstream at or after the cursor for this traffic
     * class and advances that cursor past it. HTTP advances by one, WebSocket
     * by the configured step.
     *
     * When nothing is alive the first upstream is returned and the HTTP cursor
     * is parked at its reset value instead of drifting.
     */
    public Upstream selectUpstream(boolean isWebSocket) {
        ConfigState.Tunables tunables = configState.getTunables();
        int size = upstreams.size();

        dispatchLock.lock();
        try {
            int start = isWebSocket ? wsCursor : httpCursor;
            for (int i = 0; i < size; i++) {
                int index = (start + i) % size;
                Upstream candidate = upstreams.get(index);
                if (candidate.isAlive()) {
                    if (isWebSocket) {
                        wsCursor = (index + tunables.wsStep()) % size;
                    } else {
                        httpCursor = (index + 1) % size;
                    }
                    return candidate;
                }
            }

            if (!isWebSocket) {
                httpCursor = tunables.httpResetValue();
            }
        } finally {
            dispatchLock.unlock();
        }

        Upstream fallback = upstreams.get(0);
        log.warn("No upstream is alive, falling back: upstream={}, webSocket={}",
                fallback.getAddress(), isWebSocket);
        return fallback;
    }

    /**
     * Returns the upstream pinned to {@code sessionId} while it stays alive,
     * otherwise selects a new one and pins the session to it.
     *
     * Two first-time callers for the same session may pick different upstreams;
     * the last one to bind wins.
     */
    public Upstream routeForSession(String sessionId, boolean isWebSocket) {
        String normalized = sessionId == null ? "" : sessionId.trim();
        if (normalized.isEmpty()) {
            return selectUpstream(isWebSocket);
        }

        Optional<StickyTable.Association> existing = stickyTable.lookup(normalized);
        if (existing.isPresent()) {
            Upstream pinned = byAddress.get(existing.get().address());
            if (pinned != null && pinned.isAlive()) {
                return pinned;
            }
            log.info("Sticky upstream unavailable, re-routing: sessionId={}, previous={}",
                    normalized, existing.get().address());
        }

        Upstream chosen = selectUpstream(isWebSocket);
        StickyTable.Association association = stickyTable.bind(normalized, chosen.getAddress());
        log.debug("Session pinned: sessionId={}, upstream={}, token={}",
                normalized, chosen.getAddress(), association.token());
        return chosen;
    }

    /**
     * Routes one inbound exchange and serves it through the chosen upstream's
     * interceptor chain. Requests carrying the session parameter are sticky and
     * draw new pins from the WebSocket cursor whatever their kind, leaving the
     * HTTP rotation to unpinned traffic.
     *
     * @throws IOException whatever the upstream raised while serving
     */
    public void handleRequest(ProxyExchange exchange) throws IOException {
        ProxyRequest request = exchange.request();
        Optional<String> sessionId = request.queryParameter(sessionParameter)
                .map(String::trim)
                .filter(id -> !id.isEmpty());

        Upstream upstream = sessionId.isPresent()
                ? routeForSession(sessionId.get(), true)
                : selectUpstream(false);

        ResponseSink original = exchange.response();
        ResponseSink sampled = sampler.wrap(original);
        upstream.serve(sampled == original ? exchange : exchange.withResponse(sampled));
    }

    public List<Upstream> getUpstreams() {
        return upstreams;
    }

    public int httpCursor() {
        dispatchLock.lock();
        try {
            return httpCursor;
        } finally {
            dispatchLock.unlock();
        }
    }

    public int wsCursor() {
        dispatchLock.lock();
        try {
            return wsCursor;
        } finally {
            dispatchLock.unlock();
        }
    }

    public StickyTable getStickyTable() {
        return stickyTable;
    }

    public ResponseSampler getSampler() {
        return sampler;
    }

    public ConfigState getConfigState() {
        return configState;
    }

    public String getSessionParameter() {
        return sessionParameter;
    }
}
