package com.ctm.server.live;

import java.util.Optional;

/**
 * Supplies the content pushed to a connection right after its {@code register} message.
 * An empty result sends nothing.
 */
@FunctionalInterface
public interface SnapshotProvider {

    SnapshotProvider EMPTY = role -> Optional.empty();

    Optional<Object> initialSnapshot(ConnectionRole role);
}
