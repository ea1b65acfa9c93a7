package com.ctm.store.model;

/**
 * One batch of tasks posted to the platform.
 */
public record RunRecord(
        String runId,
        long created,
        long maximum,
        long completed,
        long failed,
        String taskname,
        Number launchTime
) {
}
