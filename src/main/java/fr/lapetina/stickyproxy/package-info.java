/**
 * Sticky Proxy - session-affine HTTP and WebSocket load balancer.
 *
 * <p>Requests are spread round robin over a fixed list of backends. Requests that
 * carry a session identifier (the {@code document_id} query parameter by default)
 * stay on the backend that first served that session while it stays alive.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.stickyproxy.ProxyFactory} - builds the dispatcher, upstreams,
 *       interceptors and telemetry from YAML configuration</li>
 *   <li>{@link fr.lapetina.stickyproxy.StickyProxyApplication} - standalone proxy listener
 *       plus admin endpoint</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (StickyProxyApplication app = new StickyProxyApplication("config.yaml")) {
 *     app.start();
 *     app.awaitShutdown();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Separate HTTP and WebSocket round-robin cursors</li>
 *   <li>TTL-cached health probes, at most one in flight per backend</li>
 *   <li>Bounded sticky table with LRU eviction and idle expiry</li>
 *   <li>Micrometer metrics with Prometheus export, fed through a ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.stickyproxy.domain.dispatch.Dispatcher
 */
package fr.lapetina.stickyproxy;
