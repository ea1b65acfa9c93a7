package com.ctm.server.live;

import com.ctm.protocol.InboundCommand;
import com.ctm.protocol.JsonMessages;
import com.ctm.protocol.MalformedCommandException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One instance per live connection.
 *
 * Lifecycle:
 *   CONNECTING → handshake complete → OPEN: register, send {@code register}, push initial snapshot
 *   OPEN       → text frame        → decode {@code {cmd, data}} → dispatch
 *   OPEN       → channelInactive   → CLOSED: deregister
 *
 * Role comes from the handshake URI: {@code ?role=source} for sources, anything else
 * is a subscriber. Malformed payloads are logged and dropped; the connection stays open.
 */
public final class DashboardGateway extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(DashboardGateway.class);

    enum State { CONNECTING, OPEN, CLOSED }

    private final ConnectionRegistry registry;
    private final BroadcastRouter    router;
    private final SnapshotProvider   snapshots;

    private State          state = State.CONNECTING;
    private String         connectionId;
    private ConnectionRole role;

    public DashboardGateway(ConnectionRegistry registry, BroadcastRouter router, SnapshotProvider snapshots) {
        this.registry  = registry;
        this.router    = router;
        this.snapshots = snapshots;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            open(ctx.channel(), handshake.requestUri());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    void open(Channel channel, String requestUri) {
        if (state != State.CONNECTING) return;

        role = roleOf(requestUri);
        connectionId = registry.register(role, channel);
        state = State.OPEN;
        log.info("Opened live connection id={} role={} from {}", connectionId, role, channel.remoteAddress());

        // Runs on this channel's event loop, so broadcasts from other threads queue behind these writes.
        channel.writeAndFlush(new TextWebSocketFrame(JsonMessages.register(connectionId)));
        LiveConnection self = new LiveConnection(connectionId, role, channel);
        snapshots.initialSnapshot(role).ifPresent(data ->
                router.broadcastToSubscribers(JsonMessages.snapshot(data), List.of(self)));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (state == State.OPEN) {
            registry.deregister(connectionId, role);
            log.info("Closed live connection id={} role={} from {}", connectionId, role, ctx.channel().remoteAddress());
        }
        state = State.CLOSED;
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Live connection error id={} from {}: {}", connectionId, ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    // ── Message handling ──────────────────────────────────────────────────────

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) return;
        if (state != State.OPEN) {
            log.warn("Frame from {} before handshake completed, dropping", ctx.channel().remoteAddress());
            return;
        }
        String text = ((TextWebSocketFrame) frame).text();
        log.debug("From live connection {}: {}", connectionId, text);

        InboundCommand cmd;
        try {
            cmd = JsonMessages.parseCommand(text);
        } catch (MalformedCommandException e) {
            log.warn("Malformed payload from live connection {}: {}", connectionId, e.getMessage());
            return;
        }

        switch (cmd.type()) {
            case EVENT          -> router.broadcastToSubscribers(JsonMessages.event(cmd.data()));
            case SOURCE_COMMAND -> router.broadcastToSources(JsonMessages.sourceCommand(cmd.data()));
            case UNKNOWN        -> log.debug("Ignoring unknown command '{}' from {}", cmd.cmd(), connectionId);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    State state() { return state; }

    String connectionId() { return connectionId; }

    ConnectionRole role() { return role; }

    static ConnectionRole roleOf(String requestUri) {
        List<String> values = new QueryStringDecoder(requestUri).parameters().get("role");
        if (values == null || values.isEmpty()) return ConnectionRole.SUBSCRIBER;
        ConnectionRole r = ConnectionRole.fromQuery(values.get(0));
        if (r == null) {
            log.warn("Unknown live connection role '{}', treating as subscriber", values.get(0));
            return ConnectionRole.SUBSCRIBER;
        }
        return r;
    }
}
