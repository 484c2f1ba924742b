package fr.lapetina.stickyproxy.api;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.FullHttpRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketTunnelTest {

    private static ProxyRequest upgrade() {
        return ProxyRequest.builder()
                .method("GET")
                .uri("/socket?doc=1")
                .addHeader("Host", "proxy.example:7000")
                .addHeader("Upgrade", "websocket")
                .addHeader("Connection", "Upgrade")
                .addHeader("Sec-WebSocket-Key", "dGhlIHNhbXBsZSBub25jZQ==")
                .addHeader("Sec-WebSocket-Version", "13")
                .addHeader("X-Forwarded-Proto", "https")
                .remoteAddress("10.1.2.3")
                .build();
    }

    @Test
    @DisplayName("should replay the handshake against the backend authority")
    void shouldRewriteHostAndTarget() {
        FullHttpRequest handshake = WebSocketTunnel.handshakeRequest(upgrade(),
                URI.create("ws://10.0.0.5:8081/app/socket?doc=1"));
        try {
            assertThat(handshake.uri()).isEqualTo("/app/socket?doc=1");
            assertThat(handshake.method().name()).isEqualTo("GET");
            assertThat(handshake.headers().get("Host")).isEqualTo("10.0.0.5:8081");
            assertThat(handshake.headers().get("X-Forwarded-Host")).isEqualTo("proxy.example:7000");
        } finally {
            handshake.release();
        }
    }

    @Test
    @DisplayName("should keep the upgrade headers and append forwarding headers")
    void shouldKeepUpgradeHeaders() {
        FullHttpRequest handshake = WebSocketTunnel.handshakeRequest(upgrade(),
                URI.create("wss://backend.example/socket"));
        try {
            assertThat(handshake.headers().get("Upgrade")).isEqualTo("websocket");
            assertThat(handshake.headers().get("Connection")).isEqualTo("Upgrade");
            assertThat(handshake.headers().get("Sec-WebSocket-Key")).isEqualTo("dGhlIHNhbXBsZSBub25jZQ==");
            assertThat(handshake.headers().get("X-Forwarded-For")).isEqualTo("10.1.2.3");
            assertThat(handshake.headers().get("X-Forwarded-Proto")).isEqualTo("https");
            assertThat(handshake.headers().get("Host")).isEqualTo("backend.example");
        } finally {
            handshake.release();
        }
    }

    @Test
    @DisplayName("should default an empty path to the root")
    void shouldDefaultPath() {
        FullHttpRequest handshake = WebSocketTunnel.handshakeRequest(upgrade(), URI.create("ws://a:1"));
        try {
            assertThat(handshake.uri()).isEqualTo("/");
        } finally {
            handshake.release();
        }
    }

    @Test
    @DisplayName("should close the backend channel when the client goes away")
    void shouldCloseBackendWithClient() {
        EmbeddedChannel client = new EmbeddedChannel();
        EmbeddedChannel backend = new EmbeddedChannel();

        WebSocketTunnel.closeWithClient(client, backend);
        client.close();

        assertThat(backend.isOpen()).isFalse();
    }

    @Test
    @DisplayName("should untie refused backends from a kept-alive client")
    void shouldUntieRefusedBackends() {
        EmbeddedChannel client = new EmbeddedChannel();
        EmbeddedChannel first = new EmbeddedChannel();
        EmbeddedChannel second = new EmbeddedChannel();

        WebSocketTunnel.closeWithClient(client, first).run();
        WebSocketTunnel.closeWithClient(client, second).run();
        client.close();

        assertThat(first.isOpen()).isTrue();
        assertThat(second.isOpen()).isTrue();
        first.close();
        second.close();
    }
}
