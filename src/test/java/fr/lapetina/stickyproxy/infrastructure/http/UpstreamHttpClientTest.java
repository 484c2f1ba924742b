package fr.lapetina.stickyproxy.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.support.RecordingResponseSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamHttpClientTest {

    private HttpServer server;
    private UpstreamHttpClient client;
    private final CountDownLatch release = new CountDownLatch(1);
    private final Map<String, List<String>> received = new ConcurrentHashMap<>();
    private volatile String receivedBody;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/unhealthy/health", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.createContext("/slow/health", exchange -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/echo", exchange -> {
            exchange.getRequestHeaders().forEach((name, values) -> received.put(name.toLowerCase(), values));
            receivedBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            byte[] body = ("echo " + exchange.getRequestMethod() + " " + exchange.getRequestURI())
                    .getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-Backend", "one");
            exchange.getResponseHeaders().add("Connection", "X-Hop");
            exchange.getResponseHeaders().add("X-Hop", "secret");
            exchange.sendResponseHeaders(201, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        client = new UpstreamHttpClient(Duration.ofSeconds(2), null);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
        client.close();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    @Nested
    @DisplayName("Probe")
    class Probe {

        @Test
        @DisplayName("should pass on 200")
        void shouldPassOn200() {
            assertThat(client.probe(uri("/health"), Duration.ofSeconds(2))).isTrue();
        }

        @Test
        @DisplayName("should fail on any other status")
        void shouldFailOnNon200() {
            assertThat(client.probe(uri("/unhealthy/health"), Duration.ofSeconds(2))).isFalse();
        }

        @Test
        @DisplayName("should fail when nothing listens")
        void shouldFailWhenUnreachable() {
            URI closed = URI.create("http://127.0.0.1:1/health");

            assertThat(client.probe(closed, Duration.ofSeconds(2))).isFalse();
        }

        @Test
        @DisplayName("should give up on a hanging backend within the timeout")
        void shouldTimeOut() {
            long start = System.nanoTime();

            boolean alive = client.probe(uri("/slow/health"), Duration.ofSeconds(2));

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(alive).isFalse();
            assertThat(elapsedMs).isLessThan(4_000);
        }
    }

    @Nested
    @DisplayName("Forward")
    class Forward {

        @Test
        @DisplayName("should relay status, body and end-to-end headers")
        void shouldRelayResponse() throws Exception {
            ProxyRequest request = ProxyRequest.builder()
                    .method("POST")
                    .uri("/echo?document_id=7")
                    .body("payload".getBytes(StandardCharsets.UTF_8))
                    .remoteAddress("10.0.0.9")
                    .build();
            RecordingResponseSink sink = new RecordingResponseSink();

            int status = client.forward(uri("/echo?document_id=7"), request, sink);

            assertThat(status).isEqualTo(201);
            assertThat(sink.getStatus()).isEqualTo(201);
            assertThat(sink.bodyText()).isEqualTo("echo POST /echo?document_id=7");
            assertThat(sink.isCompleted()).isTrue();
            assertThat(receivedBody).isEqualTo("payload");
            assertThat(sink.getHeaders().keySet())
                    .anySatisfy(name -> assertThat(name).isEqualToIgnoringCase("x-backend"))
                    .anySatisfy(name -> assertThat(name).isEqualToIgnoringCase("content-length"))
                    .noneSatisfy(name -> assertThat(name).isEqualToIgnoringCase("x-hop"))
                    .noneSatisfy(name -> assertThat(name).isEqualToIgnoringCase("connection"));
        }

        @Test
        @DisplayName("should strip hop-by-hop headers and add forwarding headers")
        void shouldRewriteRequestHeaders() throws Exception {
            ProxyRequest request = ProxyRequest.builder()
                    .uri("/echo")
                    .addHeader("Host", "proxy.example")
                    .addHeader("Connection", "keep-alive, X-Private")
                    .addHeader("X-Private", "drop me")
                    .addHeader("Keep-Alive", "timeout=5")
                    .addHeader("X-Forwarded-For", "1.2.3.4")
                    .addHeader("Accept", "text/plain")
                    .remoteAddress("10.0.0.9")
                    .build();

            client.forward(uri("/echo"), request, new RecordingResponseSink());

            assertThat(received).containsKey("accept");
            assertThat(received).doesNotContainKeys("x-private", "keep-alive");
            assertThat(received.get("x-forwarded-for")).containsExactly("1.2.3.4, 10.0.0.9");
            assertThat(received.get("host")).containsExactly("127.0.0.1:" + server.getAddress().getPort());
            assertThat(received.get("x-forwarded-host")).containsExactly("proxy.example");
            assertThat(received.get("x-forwarded-proto")).containsExactly("http");
        }

        @Test
        @DisplayName("should throw when the backend is unreachable")
        void shouldThrowWhenUnreachable() {
            RecordingResponseSink sink = new RecordingResponseSink();

            assertThatThrownBy(() -> client.forward(URI.create("http://127.0.0.1:1/"),
                    ProxyRequest.builder().build(), sink))
                    .isInstanceOf(IOException.class);
            assertThat(sink.isHeadSent()).isFalse();
        }

        @Test
        @DisplayName("should build a request without restricted headers")
        void shouldDropRestrictedHeaders() {
            ProxyRequest request = ProxyRequest.builder()
                    .addHeader("Content-Length", "3")
                    .addHeader("Expect", "100-continue")
                    .addHeader("Upgrade", "h2c")
                    .addHeader("X-Kept", "yes")
                    .build();

            HttpRequest built = client.buildForwardRequest(URI.create("http://a:1/"), request);

            assertThat(built.headers().firstValue("X-Kept")).contains("yes");
            for (String stripped : UpstreamHttpClient.STRIPPED_HEADERS) {
                assertThat(built.headers().firstValue(stripped)).as(stripped).isEmpty();
            }
        }
    }
}
