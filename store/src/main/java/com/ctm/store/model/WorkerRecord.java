package com.ctm.store.model;

/**
 * Per-worker lifetime counters.
 */
public record WorkerRecord(
        String workerId,
        long accepted,
        long disconnected,
        long expired,
        long completed,
        long approved,
        long rejected
) {
}
