package com.ctm.server;

import com.ctm.common.LatencyStats;
import com.ctm.common.MonitorConfig;
import com.ctm.server.http.HttpApiHandler;
import com.ctm.server.live.BroadcastRouter;
import com.ctm.server.live.ConnectionRegistry;
import com.ctm.server.live.DashboardGateway;
import com.ctm.server.live.SnapshotProvider;
import com.ctm.server.query.QueryService;
import com.ctm.store.RecordStore;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty server carrying both the REST surface and the live channel on one port.
 *
 * Pipeline per connection:
 *   HttpServerCodec
 *   → HttpObjectAggregator              (reassemble HTTP requests)
 *   → WebSocketServerCompressionHandler
 *   → WebSocketServerProtocolHandler    (upgrades requests on the socket path, ping/pong)
 *   → DashboardGateway                  (live connection logic; one per connection)
 *   → HttpApiHandler                    (every other HTTP request; shared, on the query executors)
 */
public final class MonitorServer {

    private static final Logger log = LoggerFactory.getLogger(MonitorServer.class);

    private final MonitorConfig      cfg;
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final BroadcastRouter    router   = new BroadcastRouter(registry);
    private final SnapshotProvider   snapshots;
    private final HttpApiHandler     api;
    private final LatencyStats       httpLatency = new LatencyStats("http");

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup queryGroup;
    private Channel        serverChannel;

    public MonitorServer(MonitorConfig cfg, RecordStore store) {
        this(cfg, store, SnapshotProvider.EMPTY);
    }

    public MonitorServer(MonitorConfig cfg, RecordStore store, SnapshotProvider snapshots) {
        this.cfg       = cfg;
        this.snapshots = snapshots;
        this.api       = new HttpApiHandler(new QueryService(store), cfg.debug, httpLatency);
    }

    public void start() throws InterruptedException {
        bossGroup   = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(cfg.workerThreads);
        queryGroup  = new DefaultEventExecutorGroup(cfg.queryThreads);

        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(cfg.socketPath)
                .checkStartsWith(true)          // accept ?role=... on the socket path
                .allowExtensions(true)
                .maxFramePayloadLength(cfg.maxContentLength)
                .build();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(cfg.maxContentLength))
                                .addLast(new WebSocketServerCompressionHandler())
                                .addLast(new WebSocketServerProtocolHandler(wsConfig))
                                .addLast(new DashboardGateway(registry, router, snapshots))
                                .addLast(queryGroup, "api", api);
                    }
                });

        serverChannel = bootstrap.bind(cfg.port).sync().channel();
        log.info("Monitor listening on port {} (live channel at {})", port(), cfg.socketPath);

        if (cfg.metricsIntervalSecs > 0) {
            workerGroup.scheduleAtFixedRate(httpLatency::logAndReset,
                    cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
        }
    }

    public void stop() throws InterruptedException {
        if (serverChannel != null) serverChannel.close().sync();
        if (bossGroup   != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (queryGroup  != null) queryGroup.shutdownGracefully();
        log.info("Monitor stopped.");
    }

    /** Bound port; differs from the configured one when configured as 0. */
    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public BroadcastRouter router() {
        return router;
    }
}
