package fr.lapetina.stickyproxy.api;

import fr.lapetina.stickyproxy.domain.model.ProxyRequest;
import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exchange backed by a Netty client channel. Response calls come from a worker
 * thread, never the event loop, so they may wait on writes.
 */
final class NettyProxyExchange implements ProxyExchange {

    private final ChannelHandlerContext ctx;
    private final ProxyRequest request;
    private final boolean keepAlive;
    private final WebSocketTunnel tunnel;
    private final ChannelResponseSink channelSink;
    private final ResponseSink response;
    private final AtomicBoolean tunnelled;

    NettyProxyExchange(ChannelHandlerContext ctx, ProxyRequest request, boolean keepAlive, WebSocketTunnel tunnel) {
        this.ctx = ctx;
        this.request = request;
        this.keepAlive = keepAlive;
        this.tunnel = tunnel;
        this.channelSink = new ChannelResponseSink();
        this.response = channelSink;
        this.tunnelled = new AtomicBoolean(false);
    }

    private NettyProxyExchange(NettyProxyExchange base, ResponseSink response) {
        this.ctx = base.ctx;
        this.request = base.request;
        this.keepAlive = base.keepAlive;
        this.tunnel = base.tunnel;
        this.channelSink = base.channelSink;
        this.response = response;
        this.tunnelled = base.tunnelled;
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
        return new NettyProxyExchange(this, sink);
    }

    @Override
    public int tunnel(URI target) throws IOException {
        WebSocketTunnel.Result result = tunnel.open(ctx, request, target, response);
        if (result.upgraded()) {
            tunnelled.set(true);
        }
        return result.status();
    }

    /**
     * True when the client connection can carry another request.
     */
    boolean reusable() {
        return keepAlive && !tunnelled.get() && channelSink.completed && ctx.channel().isActive();
    }

    boolean isTunnelled() {
        return tunnelled.get();
    }

    /**
     * Answers a failed exchange: an error status while nothing was sent yet,
     * otherwise the connection is cut so the client sees a truncated response.
     */
    void fail(HttpResponseStatus status) {
        if (tunnelled.get() || channelSink.headSent) {
            ctx.close();
            return;
        }
        channelSink.headSent = true;
        byte[] body = status.reasonPhrase().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse error = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        error.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        HttpUtil.setContentLength(error, body.length);
        HttpUtil.setKeepAlive(error, false);
        ctx.writeAndFlush(error).addListener(ChannelFutureListener.CLOSE);
    }

    private final class ChannelResponseSink implements ResponseSink {

        private volatile boolean headSent;
        private volatile boolean completed;

        @Override
        public void sendHead(int status, Map<String, List<String>> headers) throws IOException {
            if (headSent) {
                throw new IllegalStateException("Response head already sent");
            }
            HttpResponse head = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.valueOf(status));
            headers.forEach((name, values) -> {
                if (!name.equalsIgnoreCase("transfer-encoding") && !name.equalsIgnoreCase("connection")
                        && !name.equalsIgnoreCase("keep-alive")) {
                    head.headers().add(name, values);
                }
            });

            boolean bodyless = "HEAD".equalsIgnoreCase(request.method())
                    || status == 204 || status == 304 || status < 200;
            if (!bodyless && !head.headers().contains(HttpHeaderNames.CONTENT_LENGTH)) {
                head.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
            }
            HttpUtil.setKeepAlive(head, keepAlive);

            headSent = true;
            await(ctx.writeAndFlush(head));
        }

        @Override
        public void write(byte[] chunk, int offset, int length) throws IOException {
            if (length == 0) {
                return;
            }
            if (!ctx.channel().isActive()) {
                throw new IOException("Client connection closed");
            }
            ChannelFuture write = ctx.writeAndFlush(new DefaultHttpContent(Unpooled.copiedBuffer(chunk, offset, length)));
            if (!ctx.channel().isWritable()) {
                await(write);
            }
        }

        @Override
        public void complete() throws IOException {
            ChannelFuture last = ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT);
            if (!keepAlive) {
                last.addListener(ChannelFutureListener.CLOSE);
            }
            await(last);
            completed = true;
        }

        @Override
        public boolean isHeadSent() {
            return headSent;
        }

        private void await(ChannelFuture future) throws IOException {
            try {
                future.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while writing to client");
            }
            if (!future.isSuccess()) {
                throw new IOException("Write to client failed", future.cause());
            }
        }
    }
}
