package fr.lapetina.stickyproxy.domain.upstream;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Outbound side of an exchange: where the proxied response is written.
 *
 * Calls happen in order: one {@link #sendHead}, any number of {@link #write},
 * then {@link #complete()}.
 */
public interface ResponseSink {

    void sendHead(int status, Map<String, List<String>> headers) throws IOException;

    void write(byte[] chunk, int offset, int length) throws IOException;

    void complete() throws IOException;

    /**
     * True once the status line has been committed to the client.
     */
    boolean isHeadSent();
}
