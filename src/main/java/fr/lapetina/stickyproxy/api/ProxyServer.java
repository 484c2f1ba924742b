package fr.lapetina.stickyproxy.api;

import fr.lapetina.stickyproxy.domain.dispatch.Dispatcher;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The proxy's inbound listener: one catch-all route for every method,
 * WebSocket upgrades included.
 *
 * Netty owns the sockets; requests are served on a cached worker pool so that
 * long-lived tunnels and slow backends never block an event loop.
 */
public final class ProxyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProxyServer.class);

    static final String CODEC = "http-codec";
    static final String AGGREGATOR = "http-aggregator";
    static final String FRONTEND = "proxy-frontend";
    static final String RELAY = "relay";

    private final String host;
    private final int requestedPort;
    private final int maxContentLength;
    private final Dispatcher dispatcher;
    private final WebSocketTunnel tunnel;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup ioGroup;
    private final ExecutorService workers;
    private Channel serverChannel;

    public ProxyServer(String host, int port, int maxContentLength, int ioThreads,
                       Dispatcher dispatcher, WebSocketTunnel tunnel) {
        this.host = host;
        this.requestedPort = port;
        this.maxContentLength = maxContentLength;
        this.dispatcher = dispatcher;
        this.tunnel = tunnel;
        this.bossGroup = new NioEventLoopGroup(1);
        this.ioGroup = new NioEventLoopGroup(ioThreads);
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory("proxy-worker"));
    }

    /**
     * Binds the listener. Port 0 picks a free port, see {@link #port()}.
     */
    public void start() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1024)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(CODEC, new HttpServerCodec());
                        p.addLast(AGGREGATOR, new HttpObjectAggregator(maxContentLength));
                        p.addLast(FRONTEND, new ProxyFrontendHandler(dispatcher, workers, tunnel));
                    }
                });

        serverChannel = bootstrap.bind(host, requestedPort).sync().channel();
        log.info("Proxy listener started: address={}, upstreams={}",
                serverChannel.localAddress(), dispatcher.getUpstreams().size());
    }

    /**
     * Port actually bound, or -1 before {@link #start()}.
     */
    public int port() {
        return serverChannel == null ? -1 : ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        workers.shutdownNow();
        log.info("Proxy listener stopped");
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
