package fr.lapetina.stickyproxy.api;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies every inbound message of its channel to a peer channel, unchanged.
 *
 * Created stopped: messages are held until {@link #start()} so the peer's
 * pipeline can finish switching protocols first. Reading pauses while the peer
 * is not writable. Must only be driven from the channels' event loop.
 */
final class RelayHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(RelayHandler.class);

    private final Channel peer;
    private final List<Object> held = new ArrayList<>();
    private boolean started;
    private ChannelHandlerContext ctx;

    RelayHandler(Channel peer) {
        this.peer = peer;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    void start() {
        started = true;
        for (Object msg : held) {
            peer.write(msg).addListener(closeOnFailure());
        }
        held.clear();
        peer.flush();
        if (!peer.isWritable()) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!started) {
            held.add(msg);
            return;
        }
        peer.writeAndFlush(msg).addListener(closeOnFailure());
        if (!peer.isWritable()) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) {
        // Our channel drained: the peer may read again
        if (ctx.channel().isWritable()) {
            peer.config().setAutoRead(true);
        }
        ctx.fireChannelWritabilityChanged();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (peer.isActive()) {
            peer.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Tunnel relay error, closing: channel={}, error={}", ctx.channel(), cause.toString());
        ctx.close();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        for (Object msg : held) {
            ReferenceCountUtil.release(msg);
        }
        held.clear();
    }

    private ChannelFutureListener closeOnFailure() {
        return future -> {
            if (!future.isSuccess()) {
                log.debug("Tunnel write failed, closing: error={}", String.valueOf(future.cause()));
                future.channel().close();
                ctx.channel().close();
            }
        };
    }
}
