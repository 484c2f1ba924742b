package fr.lapetina.stickyproxy.api;

import fr.lapetina.stickyproxy.domain.dispatch.Dispatcher;
import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Catch-all handler on every client connection: each aggregated request is
 * handed to a worker that runs it through the dispatcher.
 *
 * One request per connection is in flight at a time. Reading is suspended
 * until the worker finishes; pipelined requests wait in order.
 */
final class ProxyFrontendHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(ProxyFrontendHandler.class);

    private final Dispatcher dispatcher;
    private final ExecutorService workers;
    private final WebSocketTunnel tunnel;

    // Event loop only
    private final Deque<Pending> pending = new ArrayDeque<>();
    private boolean inFlight;

    ProxyFrontendHandler(Dispatcher dispatcher, ExecutorService workers, WebSocketTunnel tunnel) {
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.tunnel = tunnel;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) {
        if (!msg.decoderResult().isSuccess()) {
            log.debug("Malformed request, closing: remote={}, error={}",
                    ctx.channel().remoteAddress(), String.valueOf(msg.decoderResult().cause()));
            sendAndClose(ctx, HttpResponseStatus.BAD_REQUEST);
            return;
        }

        ctx.channel().config().setAutoRead(false);
        String requestId = msg.headers().get("X-Request-ID");
        pending.add(new Pending(
                toProxyRequest(ctx, msg),
                HttpUtil.isKeepAlive(msg),
                requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString()
        ));
        if (!inFlight) {
            dispatchNext(ctx);
        }
    }

    private void dispatchNext(ChannelHandlerContext ctx) {
        Pending next = pending.poll();
        if (next == null) {
            inFlight = false;
            if (ctx.channel().isActive()) {
                ctx.channel().config().setAutoRead(true);
            }
            return;
        }

        inFlight = true;
        NettyProxyExchange exchange = new NettyProxyExchange(ctx, next.request, next.keepAlive, tunnel);
        try {
            workers.execute(() -> serve(ctx, exchange, next.requestId));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected request, closing connection: remote={}", ctx.channel().remoteAddress());
            pending.clear();
            inFlight = false;
            ctx.close();
        }
    }

    private void serve(ChannelHandlerContext ctx, NettyProxyExchange exchange, String requestId) {
        MDC.put("requestId", requestId);
        try {
            dispatcher.handleRequest(exchange);
        } catch (IOException e) {
            log.warn("Upstream failure: method={}, uri={}, error={}",
                    exchange.request().method(), exchange.request().uri(), e.toString());
            exchange.fail(HttpResponseStatus.BAD_GATEWAY);
        } catch (RuntimeException e) {
            log.error("Unexpected error while proxying: method={}, uri={}",
                    exchange.request().method(), exchange.request().uri(), e);
            exchange.fail(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        } finally {
            MDC.remove("requestId");
            ctx.executor().execute(() -> onExchangeDone(ctx, exchange));
        }
    }

    private void onExchangeDone(ChannelHandlerContext ctx, NettyProxyExchange exchange) {
        if (exchange.reusable()) {
            dispatchNext(ctx);
            return;
        }
        pending.clear();
        inFlight = false;
        if (!exchange.isTunnelled() && ctx.channel().isActive()) {
            ctx.close();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        pending.clear();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Client connection error, closing: remote={}, error={}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    private static ProxyRequest toProxyRequest(ChannelHandlerContext ctx, FullHttpRequest msg) {
        ProxyRequest.Builder builder = ProxyRequest.builder()
                .method(msg.method().name())
                .uri(msg.uri())
                .body(ByteBufUtil.getBytes(msg.content()))
                .remoteAddress(remoteHost(ctx.channel().remoteAddress()));
        for (Map.Entry<String, String> header : msg.headers()) {
            builder.addHeader(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static String remoteHost(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(address);
    }

    private static void sendAndClose(ChannelHandlerContext ctx, HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private static final class Pending {
        final ProxyRequest request;
        final boolean keepAlive;
        final String requestId;

        Pending(ProxyRequest request, boolean keepAlive, String requestId) {
            this.request = request;
            this.keepAlive = keepAlive;
            this.requestId = requestId;
        }
    }
}
