package fr.lapetina.stickyproxy.infrastructure.http;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HTTP client for talking to backend servers: liveness probes and request forwarding.
 *
 * Uses java.net.http.HttpClient over HTTP/1.1. Redirects are never followed,
 * the backend's answer is relayed as is.
 */
public class UpstreamHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpstreamHttpClient.class);

    private static final int BUFFER_SIZE = 8192;

    /**
     * Hop-by-hop headers, plus the ones java.net.http refuses to let callers set.
     *
     * Host is among the refused ones: the backend sees its own authority, and the
     * inbound Host travels as X-Forwarded-Host. Starting the JVM with
     * {@code -Djdk.httpclient.allowRestrictedHeaders=host} does not bring it back,
     * since this set still drops it.
     */
    static final Set<String> STRIPPED_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "trailers", "transfer-encoding", "upgrade",
            "content-length", "date", "expect", "from", "host", "via", "warning"
    );

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * @param connectTimeout bound on TCP connect for every outbound request
     * @param requestTimeout bound on the time to receive response headers, or null for none
     */
    public UpstreamHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public UpstreamHttpClient() {
        this(Duration.ofSeconds(5), null);
    }

    /**
     * Issues {@code GET healthUri} bounded by {@code timeout}.
     *
     * @return true only for a 200 answer; errors and timeouts are folded into false
     */
    public boolean probe(URI healthUri, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(healthUri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("Health probe started: uri={}", healthUri);
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            boolean healthy = response.statusCode() == 200;
            if (healthy) {
                log.debug("Health probe passed: uri={}, status={}", healthUri, response.statusCode());
            } else {
                log.debug("Health probe failed: uri={}, status={}", healthUri, response.statusCode());
            }
            return healthy;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health probe interrupted: uri={}", healthUri);
            return false;
        } catch (IOException e) {
            log.debug("Health probe error: uri={}, error={}", healthUri, e.toString());
            return false;
        }
    }

    /**
     * Forwards {@code request} to {@code target} and streams the backend's
     * response into {@code sink}.
     *
     * @return the backend's status code
     * @throws IOException if the backend cannot be reached or the stream breaks
     */
    public int forward(URI target, ProxyRequest request, ResponseSink sink) throws IOException {
        HttpRequest httpRequest = buildForwardRequest(target, request);

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while forwarding to " + target);
        }

        log.debug("Backend answered: target={}, status={}", target, response.statusCode());

        try (InputStream body = response.body()) {
            sink.sendHead(response.statusCode(), responseHeaders(response));
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = body.read(buffer)) != -1) {
                sink.write(buffer, 0, read);
            }
            sink.complete();
        }
        return response.statusCode();
    }

    HttpRequest buildForwardRequest(URI target, ProxyRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target)
                .method(request.method(), request.body().length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }

        Set<String> connectionTokens = connectionTokens(request.headers());
        request.headers().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (STRIPPED_HEADERS.contains(lower) || connectionTokens.contains(lower)
                    || lower.startsWith("x-forwarded-")) {
                return;
            }
            for (String value : values) {
                builder.header(name, value);
            }
        });

        String forwardedFor = request.header("X-Forwarded-For")
                .map(prior -> prior + ", " + request.remoteAddress())
                .orElse(request.remoteAddress());
        builder.header("X-Forwarded-For", forwardedFor);
        request.header("Host").ifPresent(host -> builder.header("X-Forwarded-Host", host));
        builder.header("X-Forwarded-Proto", request.header("X-Forwarded-Proto").orElse("http"));
        return builder.build();
    }

    /**
     * End-to-end response headers. Content-Length is kept so the client sees a
     * sized body when the backend sent one.
     */
    static Map<String, List<String>> responseHeaders(HttpResponse<?> response) {
        Map<String, List<String>> all = response.headers().map();
        Set<String> connectionTokens = connectionTokens(all);
        Map<String, List<String>> result = new LinkedHashMap<>();
        all.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(":")) {
                return;
            }
            boolean hopByHop = STRIPPED_HEADERS.contains(lower) && !lower.equals("content-length")
                    && !lower.equals("date") && !lower.equals("via") && !lower.equals("warning");
            if (hopByHop || connectionTokens.contains(lower)) {
                return;
            }
            result.put(name, new ArrayList<>(values));
        });
        return result;
    }

    /**
     * Header names listed in Connection are hop-by-hop for this message.
     */
    private static Set<String> connectionTokens(Map<String, List<String>> headers) {
        Set<String> tokens = new HashSet<>();
        headers.forEach((name, values) -> {
            if (name.equalsIgnoreCase("Connection")) {
                for (String value : values) {
                    for (String token : value.split(",")) {
                        String trimmed = token.trim().toLowerCase(Locale.ROOT);
                        if (!trimmed.isEmpty()) {
                            tokens.add(trimmed);
                        }
                    }
                }
            }
        });
        return tokens;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; its executor threads are daemons
    }
}
