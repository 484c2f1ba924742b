/**
 * YAML configuration loading and validation.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - proxy listener (host, port, body limit, IO threads)</li>
 *   <li>{@code admin} - admin endpoint</li>
 *   <li>{@code upstreams} - ordered backend list, fixed for the process lifetime</li>
 *   <li>{@code routing} - session parameter, WebSocket step, HTTP cursor reset value</li>
 *   <li>{@code sticky} - sticky table bounds</li>
 *   <li>{@code healthCheck} - probe TTL and timeout</li>
 *   <li>{@code timeouts} - outbound connect and request timeouts</li>
 *   <li>{@code telemetry} - debug latency logging and ring buffer settings</li>
 *   <li>{@code diagnostics} - response sampling</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.stickyproxy.infrastructure.config.ConfigLoader
 */
package fr.lapetina.stickyproxy.infrastructure.config;
