package fr.lapetina.stickyproxy.domain.dispatch;

import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the first bytes of the most recently completed response for diagnostics.
 *
 * Each response is captured by its own {@link SamplingResponseSink} and published
 * here on completion. The sampler's lock is independent of the routing locks.
 */
public final class ResponseSampler {

    private final int maxBytes;
    private final Lock lock = new ReentrantLock();
    private Sample last;
    private long sampled;

    /**
     * @param maxBytes bytes kept per response; zero disables sampling
     */
    public ResponseSampler(int maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must not be negative, got " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public static ResponseSampler disabled() {
        return new ResponseSampler(0);
    }

    public boolean isEnabled() {
        return maxBytes > 0;
    }

    public int getMaxBytes() {
        return maxBytes;
    }

    /**
     * Wraps {@code delegate} so its body is sampled, or returns it unchanged when disabled.
     */
    public ResponseSink wrap(ResponseSink delegate) {
        return isEnabled() ? new SamplingResponseSink(delegate, this) : delegate;
    }

    void publish(int status, byte[] body, int length, boolean truncated) {
        Sample sample = new Sample(status, Arrays.copyOf(body, length), truncated, Instant.now());
        lock.lock();
        try {
            last = sample;
            sampled++;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Sample> lastSample() {
        lock.lock();
        try {
            return Optional.ofNullable(last);
        } finally {
            lock.unlock();
        }
    }

    public long getSampledCount() {
        lock.lock();
        try {
            return sampled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The head of one response body.
     */
    public record Sample(int status, byte[] body, boolean truncated, Instant capturedAt) {

        /**
         * Body decoded as UTF-8; malformed sequences are replaced.
         */
        public String bodyText() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
