package com.ctm.store.model;

/**
 * A worker's claim on a HIT, as recorded in the assignments table.
 */
public record AssignmentRecord(
        String assignmentId,
        String status,
        Number approveTime,
        String workerId,
        String hitId
) {
}
