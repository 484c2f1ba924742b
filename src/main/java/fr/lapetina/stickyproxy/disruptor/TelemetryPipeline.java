package fr.lapetina.stickyproxy.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.stickyproxy.domain.event.ServeEvent;
import fr.lapetina.stickyproxy.domain.event.ServeEventFactory;
import fr.lapetina.stickyproxy.domain.middleware.ServeObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves serve telemetry off the request workers through an LMAX Disruptor ring buffer.
 *
 * Many workers publish concurrently (MULTI producer). Publishing never blocks:
 * when the ring is full the event is dropped and counted, so a slow metrics
 * consumer can never add latency to proxied traffic.
 */
public final class TelemetryPipeline implements ServeObserver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

    private final Disruptor<ServeEvent> disruptor;
    private final RingBuffer<ServeEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong published = new AtomicLong(0);

    private TelemetryPipeline(Builder builder) {
        this.disruptor = new Disruptor<>(
                new ServeEventFactory(),
                builder.ringBufferSize,
                new TelemetryThreadFactory("telemetry-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        @SuppressWarnings("unchecked")
        EventHandler<ServeEvent>[] handlers = builder.handlers.toArray(new EventHandler[0]);
        disruptor.handleEventsWith(handlers);
        disruptor.setDefaultExceptionHandler(new TelemetryExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("TelemetryPipeline created: ringBufferSize={}, waitStrategy={}, handlers={}",
                builder.ringBufferSize, builder.waitStrategy, builder.handlers.size());
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("TelemetryPipeline started");
        }
    }

    @Override
    public void onServed(String address, String method, int status, long durationNanos,
                         boolean webSocket, boolean failed) {
        publish(address, method, status, durationNanos, webSocket, failed);
    }

    /**
     * @return false when the event was dropped (pipeline stopped or ring full)
     */
    public boolean publish(String address, String method, int status, long durationNanos,
                           boolean webSocket, boolean failed) {
        if (!running.get()) {
            dropped.incrementAndGet();
            return false;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 1000 == 0) {
                log.warn("Telemetry ring buffer full, dropping events: dropped={}", total);
            }
            return false;
        }

        try {
            ringBuffer.get(sequence).initialize(address, method, status, durationNanos, webSocket, failed);
        } finally {
            ringBuffer.publish(sequence);
        }
        published.incrementAndGet();
        return true;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down TelemetryPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("TelemetryPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("TelemetryPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class TelemetryThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        TelemetryThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class TelemetryExceptionHandler implements ExceptionHandler<ServeEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, ServeEvent event) {
            log.error("Exception in telemetry handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during telemetry pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during telemetry pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private final List<EventHandler<ServeEvent>> handlers = new ArrayList<>();

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size < 1 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2, got " + size);
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder handler(EventHandler<ServeEvent> handler) {
            this.handlers.add(handler);
            return this;
        }

        public TelemetryPipeline build() {
            if (handlers.isEmpty()) {
                throw new IllegalStateException("At least one telemetry handler is required");
            }
            return new TelemetryPipeline(this);
        }
    }
}
