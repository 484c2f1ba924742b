package fr.lapetina.stickyproxy.support;

import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Response sink keeping everything written to it.
 */
public final class RecordingResponseSink implements ResponseSink {

    private int status;
    private Map<String, List<String>> headers = Map.of();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private boolean headSent;
    private boolean completed;

    @Override
    public void sendHead(int status, Map<String, List<String>> headers) {
        this.status = status;
        this.headers = headers;
        this.headSent = true;
    }

    @Override
    public void write(byte[] chunk, int offset, int length) {
        body.write(chunk, offset, length);
    }

    @Override
    public void complete() {
        completed = true;
    }

    @Override
    public boolean isHeadSent() {
        return headSent;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String bodyText() {
        return body.toString(StandardCharsets.UTF_8);
    }

    public boolean isCompleted() {
        return completed;
    }
}
