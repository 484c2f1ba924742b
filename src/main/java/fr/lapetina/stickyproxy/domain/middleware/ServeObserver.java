package fr.lapetina.stickyproxy.domain.middleware;

/**
 * Receives one record per completed {@code serve}. Must not block.
 */
@FunctionalInterface
public interface ServeObserver {

    /**
     * @param status        response status, 0 when no response head was produced
     * @param durationNanos wall time spent in serve, tunnel lifetime for WebSockets
     * @param failed        true when serve ended with an exception
     */
    void onServed(String address, String method, int status, long durationNanos,
                  boolean webSocket, boolean failed);

    ServeObserver NONE = (address, method, status, durationNanos, webSocket, failed) -> { };
}
