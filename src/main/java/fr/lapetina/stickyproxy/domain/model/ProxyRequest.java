package fr.lapetina.stickyproxy.domain.model;

import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of an inbound request, independent of the transport that read it.
 *
 * Header names are case-insensitive. The body is fully buffered; WebSocket
 * handshakes carry an empty body.
 */
public final class ProxyRequest {

    private final String method;
    private final String uri;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String remoteAddress;

    private ProxyRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "Method is required");
        this.uri = Objects.requireNonNull(builder.uri, "URI is required");
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builder.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = builder.body;
        this.remoteAddress = builder.remoteAddress;
    }

    public String method() {
        return method;
    }

    /**
     * Request target as received: path plus optional query, e.g. {@code /docs?document_id=42}.
     */
    public String uri() {
        return uri;
    }

    public String path() {
        int idx = uri.indexOf('?');
        return idx >= 0 ? uri.substring(0, idx) : uri;
    }

    public Optional<String> rawQuery() {
        int idx = uri.indexOf('?');
        return idx >= 0 && idx < uri.length() - 1 ? Optional.of(uri.substring(idx + 1)) : Optional.empty();
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public byte[] body() {
        return body;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    /**
     * Returns the first decoded value of a query parameter. A parameter present
     * with an empty value is reported as empty.
     */
    public Optional<String> queryParameter(String name) {
        return queryParameter(uri, name);
    }

    /**
     * First decoded value of a query parameter in a request target such as
     * {@code /docs?document_id=42}. Empty values and a query with malformed
     * percent-encoding are reported as empty.
     */
    public static Optional<String> queryParameter(String requestTarget, String name) {
        Map<String, List<String>> parameters;
        try {
            parameters = new QueryStringDecoder(requestTarget, StandardCharsets.UTF_8).parameters();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    /**
     * True for an HTTP/1.1 WebSocket opening handshake.
     */
    public boolean isWebSocketUpgrade() {
        boolean upgradeHeader = header("Upgrade")
                .map(v -> v.trim().equalsIgnoreCase("websocket"))
                .orElse(false);
        if (!upgradeHeader) {
            return false;
        }
        List<String> connection = headers.getOrDefault("Connection", List.of());
        for (String value : connection) {
            for (String token : value.split(",")) {
                if (token.trim().equalsIgnoreCase("upgrade")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ProxyRequest{" +
                "method='" + method + '\'' +
                ", uri='" + uri + '\'' +
                ", bodyBytes=" + body.length +
                ", remoteAddress='" + remoteAddress + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method = "GET";
        private String uri = "/";
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body = new byte[0];
        private String remoteAddress = "unknown";

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder addHeader(String name, String value) {
            this.headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body != null ? body : new byte[0];
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public ProxyRequest build() {
            return new ProxyRequest(this);
        }
    }
}
