package fr.lapetina.stickyproxy.domain.model;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared routing tunables and the process-wide forwarded-request counter.
 *
 * Constructed once by the factory and handed by reference to the dispatcher,
 * every upstream and every interceptor. Read-mostly: the counter is the only
 * value that changes after construction.
 *
 * Thread-safe: the counter is lock-free, the tunables are guarded by a read lock.
 */
public final class ConfigState {

    private final AtomicLong globalRequestCounter = new AtomicLong(0);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final int wsRoundRobinStep;
    private final int httpCursorResetValue;
    private final boolean debugMode;

    public ConfigState(int wsRoundRobinStep, int httpCursorResetValue, boolean debugMode) {
        if (wsRoundRobinStep < 1) {
            throw new IllegalArgumentException("wsRoundRobinStep must be >= 1, got " + wsRoundRobinStep);
        }
        if (httpCursorResetValue < 0) {
            throw new IllegalArgumentException("httpCursorResetValue must be >= 0, got " + httpCursorResetValue);
        }
        this.wsRoundRobinStep = wsRoundRobinStep;
        this.httpCursorResetValue = httpCursorResetValue;
        this.debugMode = debugMode;
    }

    /**
     * Default tunables: WebSocket step 2, HTTP reset value 0, debug off.
     */
    public static ConfigState defaults() {
        return new ConfigState(2, 0, false);
    }

    public void incrementGlobalCounter() {
        globalRequestCounter.incrementAndGet();
    }

    /**
     * Number of requests forwarded since start. Used for observability only,
     * so wrap-around after 2^63 is tolerated.
     */
    public long getGlobalCounter() {
        return globalRequestCounter.get();
    }

    public Tunables getTunables() {
        lock.readLock().lock();
        try {
            return new Tunables(wsRoundRobinStep, httpCursorResetValue);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    @Override
    public String toString() {
        return "ConfigState{" +
                "wsRoundRobinStep=" + wsRoundRobinStep +
                ", httpCursorResetValue=" + httpCursorResetValue +
                ", debugMode=" + debugMode +
                ", globalRequestCounter=" + globalRequestCounter.get() +
                '}';
    }

    /**
     * Routing offsets read by the dispatcher on every selection.
     *
     * @param wsStep         cursor advance applied after a WebSocket selection
     * @param httpResetValue HTTP cursor position parked on total outage
     */
    public record Tunables(int wsStep, int httpResetValue) {
    }
}
