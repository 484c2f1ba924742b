package fr.lapetina.stickyproxy.domain.dispatch;

import fr.lapetina.stickyproxy.domain.model.ConnectionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Session affinity table: session id to connection token to upstream address.
 *
 * Bounded LRU. An entry idle for longer than the idle TTL is treated as absent
 * and removed on the next access or bind. Evicting a session drops its token too.
 * All operations run under one lock and never perform I/O.
 */
public final class StickyTable {

    private static final Logger log = LoggerFactory.getLogger(StickyTable.class);

    private final int maxEntries;
    private final long idleTtlNanos;
    private final LongSupplier nanoClock;

    private final Lock lock = new ReentrantLock();
    // Oldest access first; lookup re-inserts to refresh recency so peek can read without reordering
    private final LinkedHashMap<String, Entry> sessions = new LinkedHashMap<>();
    private final Map<ConnectionToken, String> tokens = new HashMap<>();
    private long evictions;

    /**
     * @param maxEntries maximum number of sessions kept
     * @param idleTtl    idle time after which a session is forgotten, zero to keep forever
     */
    public StickyTable(int maxEntries, Duration idleTtl) {
        this(maxEntries, idleTtl, System::nanoTime);
    }

    StickyTable(int maxEntries, Duration idleTtl, LongSupplier nanoClock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got " + maxEntries);
        }
        if (idleTtl.isNegative()) {
            throw new IllegalArgumentException("idleTtl must not be negative, got " + idleTtl);
        }
        this.maxEntries = maxEntries;
        this.idleTtlNanos = idleTtl.toNanos();
        this.nanoClock = nanoClock;
    }

    public static StickyTable unbounded() {
        return new StickyTable(Integer.MAX_VALUE, Duration.ZERO);
    }

    /**
     * Current association for a session, refreshing its recency.
     */
    public Optional<Association> lookup(String sessionId) {
        lock.lock();
        try {
            Entry entry = sessions.get(sessionId);
            if (entry == null) {
                return Optional.empty();
            }
            long now = nanoClock.getAsLong();
            if (isExpired(entry, now)) {
                remove(sessionId, entry);
                return Optional.empty();
            }
            entry.lastAccessNanos = now;
            sessions.remove(sessionId);
            sessions.put(sessionId, entry);
            return Optional.of(new Association(entry.token, entry.address));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current association for a session without refreshing its recency or idle
     * timer. An expired entry is reported as absent and left for the next purge.
     */
    public Optional<Association> peek(String sessionId) {
        lock.lock();
        try {
            Entry entry = sessions.get(sessionId);
            if (entry == null || isExpired(entry, nanoClock.getAsLong())) {
                return Optional.empty();
            }
            return Optional.of(new Association(entry.token, entry.address));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pins a session to an address under a fresh token, replacing any previous
     * association. Last write wins.
     */
    public Association bind(String sessionId, String address) {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            Entry previous = sessions.remove(sessionId);
            if (previous != null) {
                tokens.remove(previous.token);
            }
            purgeExpired(now);
            while (sessions.size() >= maxEntries) {
                evictEldest();
            }

            ConnectionToken token = ConnectionToken.random();
            sessions.put(sessionId, new Entry(token, address, now));
            tokens.put(token, address);
            return new Association(token, address);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Upstream address a token was issued for, without needing the session id.
     */
    public Optional<String> addressForToken(ConnectionToken token) {
        lock.lock();
        try {
            return Optional.ofNullable(tokens.get(token));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public long getEvictions() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    private boolean isExpired(Entry entry, long now) {
        return idleTtlNanos > 0 && now - entry.lastAccessNanos >= idleTtlNanos;
    }

    private void purgeExpired(long now) {
        if (idleTtlNanos == 0) {
            return;
        }
        // Eldest entries come first, stop at the first live one
        Iterator<Map.Entry<String, Entry>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> next = it.next();
            if (!isExpired(next.getValue(), now)) {
                break;
            }
            tokens.remove(next.getValue().token);
            it.remove();
            evictions++;
        }
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, Entry>> it = sessions.entrySet().iterator();
        Map.Entry<String, Entry> eldest = it.next();
        tokens.remove(eldest.getValue().token);
        it.remove();
        evictions++;
        log.debug("Sticky session evicted: sessionId={}, upstream={}", eldest.getKey(), eldest.getValue().address);
    }

    private void remove(String sessionId, Entry entry) {
        sessions.remove(sessionId);
        tokens.remove(entry.token);
        evictions++;
    }

    /**
     * A session's pinned upstream and the token minted for that pin.
     */
    public record Association(ConnectionToken token, String address) {
    }

    private static final class Entry {
        final ConnectionToken token;
        final String address;
        long lastAccessNanos;

        Entry(ConnectionToken token, String address, long lastAccessNanos) {
            this.token = token;
            this.address = address;
            this.lastAccessNanos = lastAccessNanos;
        }
    }
}
