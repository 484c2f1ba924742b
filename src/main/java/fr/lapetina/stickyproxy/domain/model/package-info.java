/**
 * Core value types shared by the dispatcher, upstreams and interceptors.
 *
 * <ul>
 *   <li>{@link fr.lapetina.stickyproxy.domain.model.ConfigState} - routing tunables and the request counter</li>
 *   <li>{@link fr.lapetina.stickyproxy.domain.model.ProxyRequest} - transport-neutral inbound request</li>
 *   <li>{@link fr.lapetina.stickyproxy.domain.model.ConnectionToken} - opaque sticky-table key</li>
 * </ul>
 */
package fr.lapetina.stickyproxy.domain.model;
