package com.ctm.server.live;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Fans a serialized message out to live connections.
 *
 * The message is UTF-8 encoded once; each target gets its own frame over a retained
 * duplicate of that buffer. A failure on one target (inactive channel, rejected
 * write, failed write future) is treated as connection loss for that target only: it is
 * deregistered and closed, and the fan-out carries on. Nothing is thrown to the caller.
 *
 * Writes are asynchronous. Messages to one connection keep their call order; there is
 * no ordering between different connections.
 */
public final class BroadcastRouter {

    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final ConnectionRegistry registry;

    public BroadcastRouter(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /** @return number of targets the message was handed to */
    public int broadcastToSubscribers(String json) {
        return fanOut(json, registry.list(ConnectionRole.SUBSCRIBER));
    }

    public int broadcastToSubscribers(String json, Collection<LiveConnection> targets) {
        return fanOut(json, targets);
    }

    public int broadcastToSources(String json) {
        return fanOut(json, registry.list(ConnectionRole.SOURCE));
    }

    private int fanOut(String json, Collection<LiveConnection> targets) {
        if (targets.isEmpty()) return 0;
        ByteBuf payload = Unpooled.copiedBuffer(json, StandardCharsets.UTF_8);
        int handed = 0;
        try {
            for (LiveConnection target : targets) {
                Channel ch = target.channel();
                if (!ch.isActive()) {
                    connectionLost(target, null);
                    continue;
                }
                try {
                    ch.writeAndFlush(new TextWebSocketFrame(payload.retainedDuplicate())).addListener(f -> {
                        if (!f.isSuccess()) connectionLost(target, f.cause());
                    });
                    handed++;
                } catch (RuntimeException e) {
                    connectionLost(target, e);
                }
            }
        } finally {
            payload.release();
        }
        return handed;
    }

    private void connectionLost(LiveConnection target, Throwable cause) {
        if (registry.deregister(target.id(), target.role())) {
            log.warn("Dropping {} {} ({}) after failed delivery: {}", target.role(), target.id(), target.peer(),
                    cause != null ? cause.toString() : "channel inactive");
        }
        target.channel().close();
    }
}
