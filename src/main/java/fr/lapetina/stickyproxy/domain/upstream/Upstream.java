package fr.lapetina.stickyproxy.domain.upstream;

import java.io.IOException;

/**
 * Capability set shared by a backend and every interceptor wrapped around it.
 *
 * Implementations must be thread-safe: the dispatcher calls {@link #isAlive()}
 * from many request workers at once, and {@link #serve(ProxyExchange)} runs
 * concurrently for every request routed to the same backend.
 */
public interface Upstream {

    /**
     * Returns the backend's base address exactly as configured.
     */
    String getAddress();

    /**
     * Reports whether the backend is eligible for routing.
     * May block on a health probe; never throws.
     */
    boolean isAlive();

    /**
     * Forwards the exchange to the backend and proxies the response back.
     * No retries: a failure once serving has started is surfaced to the caller.
     *
     * @throws IOException if the backend cannot be reached or fails mid-flight
     */
    void serve(ProxyExchange exchange) throws IOException;
}
