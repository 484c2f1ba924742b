package fr.lapetina.stickyproxy.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link ServeEvent} slots for the telemetry ring buffer.
 */
public final class ServeEventFactory implements EventFactory<ServeEvent> {

    @Override
    public ServeEvent newInstance() {
        return new ServeEvent();
    }
}
