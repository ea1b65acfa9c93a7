package com.ctm.store.model;

public record HitRecord(
        String hitId,
        long expiration,
        String hitStatus,
        Integer assignmentsPending,
        Integer assignmentsAvailable,
        Integer assignmentsComplete,
        String runId
) {
}
