package fr.lapetina.stickyproxy.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.stickyproxy.domain.event.ServeEvent;
import fr.lapetina.stickyproxy.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Turns serve events into request counters and latency timers.
 */
public final class MetricsHandler implements EventHandler<ServeEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(ServeEvent event, long sequence, boolean endOfBatch) {
        try {
            String outcome = event.outcome();
            metricsRegistry.incrementRequestCount(event.getAddress(), outcome);
            metricsRegistry.recordLatency(event.getAddress(), event.isWebSocket(),
                    Duration.ofNanos(event.getDurationNanos()));
            if (event.isFailed()) {
                log.debug("Serve failure recorded: upstream={}, method={}", event.getAddress(), event.getMethod());
            }
        } finally {
            event.clear();
        }
    }
}
