package fr.lapetina.stickyproxy.domain.upstream;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;

import java.io.IOException;
import java.net.URI;

/**
 * One inbound request together with the means to answer it.
 *
 * The transport implements this seam; the domain never touches sockets directly.
 */
public interface ProxyExchange {

    ProxyRequest request();

    ResponseSink response();

    /**
     * Returns a view of this exchange whose response is written to {@code sink}.
     */
    ProxyExchange withResponse(ResponseSink sink);

    /**
     * Replays the WebSocket handshake to {@code target} and relays raw bytes in
     * both directions. Blocks until either side closes the tunnel.
     *
     * @return the status the backend answered the handshake with
     * @throws IOException if the backend cannot be reached
     */
    int tunnel(URI target) throws IOException;
}
