package fr.lapetina.stickyproxy.support;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Exchange over a {@link RecordingResponseSink}; tunnels answer with a fixed status.
 */
public final class StubExchange implements ProxyExchange {

    private final ProxyRequest request;
    private final ResponseSink response;
    private final RecordingResponseSink recording;
    private final List<URI> tunnelTargets;
    private final int tunnelStatus;

    public StubExchange(ProxyRequest request) {
        this(request, 101);
    }

    public StubExchange(ProxyRequest request, int tunnelStatus) {
        this.request = request;
        this.recording = new RecordingResponseSink();
        this.response = recording;
        this.tunnelTargets = new CopyOnWriteArrayList<>();
        this.tunnelStatus = tunnelStatus;
    }

    private StubExchange(StubExchange base, ResponseSink response) {
        this.request = base.request;
        this.recording = base.recording;
        this.response = response;
        this.tunnelTargets = base.tunnelTargets;
        this.tunnelStatus = base.tunnelStatus;
    }

    public static StubExchange get(String uri) {
        return new StubExchange(ProxyRequest.builder().method("GET").uri(uri).build());
    }

    public static StubExchange webSocket(String uri) {
        return new StubExchange(ProxyRequest.builder()
                .method("GET")
                .uri(uri)
                .addHeader("Upgrade", "websocket")
                .addHeader("Connection", "Upgrade")
                .build());
    }

    @Override
    public ProxyRequest request() {
        return request;
    }

    @Override
    public ResponseSink response() {
        return response;
    }

    @Override
    public ProxyExchange withResponse(ResponseSink sink) {
        return new StubExchange(this, sink);
    }

    @Override
    public int tunnel(URI target) {
        tunnelTargets.add(target);
        return tunnelStatus;
    }

    public RecordingResponseSink recorded() {
        return recording;
    }

    public List<URI> getTunnelTargets() {
        return tunnelTargets;
    }
}
