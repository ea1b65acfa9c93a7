package com.ctm.server.live;

import io.netty.channel.Channel;

/**
 * A registered live connection. Owned by {@link ConnectionRegistry} from registration
 * until its channel closes.
 */
public record LiveConnection(String id, ConnectionRole role, Channel channel) {

    public String peer() {
        return String.valueOf(channel.remoteAddress());
    }
}
