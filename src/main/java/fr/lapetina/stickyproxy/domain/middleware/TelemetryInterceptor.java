package fr.lapetina.stickyproxy.domain.middleware;

import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Measures how long each serve takes.
 *
 * The latency line is logged only in debug mode; the measurement itself is
 * always handed to the {@link ServeObserver}, which feeds the metrics pipeline.
 */
public final class TelemetryInterceptor implements UpstreamInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TelemetryInterceptor.class);

    private final ConfigState configState;
    private final ServeObserver observer;

    public TelemetryInterceptor(ConfigState configState, ServeObserver observer) {
        this.configState = Objects.requireNonNull(configState, "ConfigState is required");
        this.observer = observer != null ? observer : ServeObserver.NONE;
    }

    public TelemetryInterceptor(ConfigState configState) {
        this(configState, ServeObserver.NONE);
    }

    @Override
    public void intercept(String address, ProxyExchange exchange, Chain next) throws IOException {
        ProxyRequest request = exchange.request();
        AtomicInteger status = new AtomicInteger(0);
        boolean failed = true;
        long start = System.nanoTime();
        try {
            next.proceed(new StatusRecordingExchange(exchange, status));
            failed = false;
        } finally {
            long elapsed = System.nanoTime() - start;
            if (configState.isDebugMode()) {
                log.info("Request latency: upstream={}, duration={}, status={}",
                        address, Duration.ofNanos(elapsed), status.get());
            }
            observer.onServed(address, request.method(), status.get(), elapsed,
                    request.isWebSocketUpgrade(), failed);
        }
    }

    /**
     * Remembers the status the backend answered with, from either the response
     * head or the WebSocket handshake.
     */
    private static final class StatusRecordingExchange implements ProxyExchange {

        private final ProxyExchange delegate;
        private final AtomicInteger status;

        StatusRecordingExchange(ProxyExchange delegate, AtomicInteger status) {
            this.delegate = delegate;
            this.status = status;
        }

        @Override
        public ProxyRequest request() {
            return delegate.request();
        }

        @Override
        public ResponseSink response() {
            ResponseSink sink = delegate.response();
            return new ResponseSink() {
                @Override
                public void sendHead(int code, Map<String, List<String>> headers) throws IOException {
                    status.set(code);
                    sink.sendHead(code, headers);
                }

                @Override
                public void write(byte[] chunk, int offset, int length) throws IOException {
                    sink.write(chunk, offset, length);
                }

                @Override
                public void complete() throws IOException {
                    sink.complete();
                }

                @Override
                public boolean isHeadSent() {
                    return sink.isHeadSent();
                }
            };
        }

        @Override
        public ProxyExchange withResponse(ResponseSink sink) {
            return new StatusRecordingExchange(delegate.withResponse(sink), status);
        }

        @Override
        public int tunnel(URI target) throws IOException {
            int code = delegate.tunnel(target);
            status.set(code);
            return code;
        }
    }
}
