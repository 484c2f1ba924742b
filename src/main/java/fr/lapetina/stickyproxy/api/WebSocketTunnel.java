package fr.lapetina.stickyproxy.api;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tunnels a WebSocket connection to a backend.
 *
 * The client's opening handshake is replayed to the backend over a Netty
 * client channel sharing the client's event loop. On {@code 101} both
 * pipelines drop their HTTP codecs and relay raw bytes until either side
 * closes. Any other answer is handed back to the caller and written as an
 * ordinary response.
 */
public final class WebSocketTunnel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTunnel.class);

    private static final int MAX_HANDSHAKE_RESPONSE = 64 * 1024;
    private static final String HANDSHAKE = "ws-handshake";

    private final int connectTimeoutMs;
    private final long handshakeTimeoutMs;
    private volatile SslContext sslContext;

    /**
     * @param handshakeTimeoutMs bound on waiting for the backend's handshake answer, 0 for none
     */
    public WebSocketTunnel(int connectTimeoutMs, long handshakeTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
    }

    /**
     * Opens the tunnel and blocks until it closes. Must not be called from an event loop.
     *
     * @param frontendCtx context of the proxy's frontend handler on the client channel
     * @param sink        where a refused handshake answer is written
     * @return the backend's handshake status, and whether the connection was upgraded
     * @throws IOException if the backend cannot be reached or does not answer
     */
    public Result open(ChannelHandlerContext frontendCtx, ProxyRequest request, URI target,
                       ResponseSink sink) throws IOException {
        Channel client = frontendCtx.channel();
        boolean secure = "wss".equalsIgnoreCase(target.getScheme());
        String host = target.getHost();
        int port = target.getPort() != -1 ? target.getPort() : (secure ? 443 : 80);
        SslContext ssl = secure ? sslContext() : null;

        CompletableFuture<FullHttpResponse> outcome = new CompletableFuture<>();
        HandshakeHandler handshakeHandler = new HandshakeHandler(frontendCtx, outcome);

        Bootstrap bootstrap = new Bootstrap()
                .group(client.eventLoop())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast("ssl", ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(ProxyServer.CODEC, new HttpClientCodec());
                        p.addLast(ProxyServer.AGGREGATOR, new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE));
                        p.addLast(HANDSHAKE, handshakeHandler);
                    }
                });

        log.debug("Opening WebSocket tunnel: target={}", target);
        ChannelFuture connect = bootstrap.connect(host, port);
        Channel backend = connect.channel();
        Runnable detach = closeWithClient(client, backend);
        connect.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                outcome.completeExceptionally(new IOException("Cannot connect to " + target, f.cause()));
                return;
            }
            f.channel().writeAndFlush(handshakeRequest(request, target)).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) {
                    outcome.completeExceptionally(new IOException("Cannot send handshake to " + target, w.cause()));
                    w.channel().close();
                }
            });
        });

        FullHttpResponse refused;
        try {
            refused = awaitHandshake(outcome, backend, target);
        } catch (IOException e) {
            detach.run();
            throw e;
        }
        if (refused == null) {
            awaitClose(backend, client);
            return new Result(HttpResponseStatus.SWITCHING_PROTOCOLS.code(), true);
        }

        try {
            int status = refused.status().code();
            log.debug("WebSocket handshake refused by backend: target={}, status={}", target, status);
            byte[] body = ByteBufUtil.getBytes(refused.content());
            sink.sendHead(status, endToEndHeaders(refused));
            if (body.length > 0) {
                sink.write(body, 0, body.length);
            }
            sink.complete();
            return new Result(status, false);
        } finally {
            refused.release();
            detach.run();
            backend.close();
        }
    }

    /**
     * Closes {@code backend} when {@code client} closes. The returned action
     * unties them again, for a client connection that outlives this backend.
     */
    static Runnable closeWithClient(Channel client, Channel backend) {
        ChannelFutureListener closeBackend = f -> backend.close();
        client.closeFuture().addListener(closeBackend);
        return () -> client.closeFuture().removeListener(closeBackend);
    }

    private FullHttpResponse awaitHandshake(CompletableFuture<FullHttpResponse> outcome, Channel backend,
                                            URI target) throws IOException {
        try {
            return handshakeTimeoutMs > 0
                    ? outcome.get(handshakeTimeoutMs, TimeUnit.MILLISECONDS)
                    : outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            backend.close();
            throw new InterruptedIOException("Interrupted during WebSocket handshake with " + target);
        } catch (TimeoutException e) {
            backend.close();
            throw new IOException("WebSocket handshake with " + target + " timed out after "
                    + handshakeTimeoutMs + "ms");
        } catch (ExecutionException e) {
            backend.close();
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("WebSocket handshake with " + target + " failed", cause);
        }
    }

    private static void awaitClose(Channel backend, Channel client) throws IOException {
        try {
            backend.closeFuture().await();
            client.closeFuture().await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            backend.close();
            client.close();
            throw new InterruptedIOException("Interrupted while tunnelling");
        }
    }

    static FullHttpRequest handshakeRequest(ProxyRequest request, URI target) {
        String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
        String uri = target.getRawQuery() == null ? path : path + "?" + target.getRawQuery();
        FullHttpRequest handshake = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.valueOf(request.method()), uri);

        request.headers().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("host") || lower.equals("content-length") || lower.startsWith("x-forwarded-")) {
                return;
            }
            for (String value : values) {
                handshake.headers().add(name, value);
            }
        });
        handshake.headers().set(HttpHeaderNames.HOST, target.getRawAuthority());
        String forwardedFor = request.header("X-Forwarded-For")
                .map(prior -> prior + ", " + request.remoteAddress())
                .orElse(request.remoteAddress());
        handshake.headers().set("X-Forwarded-For", forwardedFor);
        request.header("Host").ifPresent(h -> handshake.headers().set("X-Forwarded-Host", h));
        handshake.headers().set("X-Forwarded-Proto", request.header("X-Forwarded-Proto").orElse("http"));
        return handshake;
    }

    private static Map<String, List<String>> endToEndHeaders(FullHttpResponse response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("connection") || lower.equals("upgrade") || lower.equals("keep-alive")
                    || lower.equals("transfer-encoding")) {
                continue;
            }
            headers.put(name, new ArrayList<>(response.headers().getAll(name)));
        }
        // The aggregated body is sized even if the backend chunked it
        headers.keySet().removeIf(name -> name.equalsIgnoreCase("content-length"));
        headers.put("Content-Length", List.of(String.valueOf(response.content().readableBytes())));
        return headers;
    }

    private SslContext sslContext() throws IOException {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    ctx = SslContextBuilder.forClient().build();
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }

    /**
     * @param status   status the backend answered the handshake with
     * @param upgraded true when bytes were relayed until close
     */
    public record Result(int status, boolean upgraded) {
    }

    /**
     * Waits for the backend's handshake answer. On 101 it forwards the answer to
     * the client and swaps both pipelines over to raw relaying; raw bytes that
     * arrive in between are held and forwarded first.
     */
    private static final class HandshakeHandler extends ChannelInboundHandlerAdapter {

        private final ChannelHandlerContext frontendCtx;
        private final CompletableFuture<FullHttpResponse> outcome;
        private final List<ByteBuf> early = new ArrayList<>();
        private boolean upgraded;

        HandshakeHandler(ChannelHandlerContext frontendCtx, CompletableFuture<FullHttpResponse> outcome) {
            this.frontendCtx = frontendCtx;
            this.outcome = outcome;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (!upgraded && msg instanceof FullHttpResponse) {
                FullHttpResponse response = (FullHttpResponse) msg;
                if (response.status().code() == HttpResponseStatus.SWITCHING_PROTOCOLS.code()) {
                    upgraded = true;
                    try {
                        switchProtocols(ctx, response);
                    } finally {
                        response.release();
                    }
                } else if (!outcome.complete(response)) {
                    response.release();
                }
                return;
            }
            if (upgraded && msg instanceof ByteBuf) {
                early.add((ByteBuf) msg);
                return;
            }
            ReferenceCountUtil.release(msg);
        }

        private void switchProtocols(ChannelHandlerContext backendCtx, FullHttpResponse response) {
            Channel backend = backendCtx.channel();
            Channel client = frontendCtx.channel();
            backend.config().setAutoRead(false);
            backend.closeFuture().addListener((ChannelFutureListener) f -> client.close());

            FullHttpResponse switching = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1, HttpResponseStatus.SWITCHING_PROTOCOLS);
            switching.headers().set(response.headers());

            frontendCtx.writeAndFlush(switching).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    log.debug("Client went away during WebSocket upgrade: error={}", String.valueOf(f.cause()));
                    releaseEarly();
                    backend.close();
                    client.close();
                } else {
                    installRelays(backendCtx, backend, client);
                }
                outcome.complete(null);
            });
        }

        private void installRelays(ChannelHandlerContext backendCtx, Channel backend, Channel client) {
            RelayHandler toClient = new RelayHandler(client);
            RelayHandler toBackend = new RelayHandler(backend);

            ChannelPipeline bp = backend.pipeline();
            bp.replace(this, ProxyServer.RELAY, toClient);
            bp.remove(ProxyServer.AGGREGATOR);
            bp.remove(ProxyServer.CODEC);

            ChannelPipeline fp = client.pipeline();
            fp.replace(ProxyServer.FRONTEND, ProxyServer.RELAY, toBackend);
            fp.remove(ProxyServer.AGGREGATOR);
            fp.remove(ProxyServer.CODEC);

            for (ByteBuf buf : early) {
                client.write(buf);
            }
            early.clear();
            toClient.start();
            toBackend.start();

            client.config().setAutoRead(true);
            backend.config().setAutoRead(true);
            log.debug("WebSocket tunnel established: client={}, backend={}",
                    client.remoteAddress(), backend.remoteAddress());
        }

        private void releaseEarly() {
            for (ByteBuf buf : early) {
                buf.release();
            }
            early.clear();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            outcome.completeExceptionally(new IOException("Backend closed before completing the WebSocket handshake"));
            releaseEarly();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            outcome.completeExceptionally(cause instanceof IOException
                    ? cause
                    : new IOException("WebSocket handshake failed", cause));
            ctx.close();
        }
    }
}
