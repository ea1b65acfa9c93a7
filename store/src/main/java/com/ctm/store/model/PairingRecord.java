package com.ctm.store.model;

/**
 * World/session outcome recorded against an assignment.
 *
 * {@code status} is the world's status, distinct from the assignment's own status;
 * merged views expose it as {@code world_status}. Times and bonus amounts are kept as
 * stored: {@link Long} for INTEGER values, {@link java.math.BigDecimal} for REAL ones.
 */
public record PairingRecord(
        String status,
        Number onboardingStart,
        Number onboardingEnd,
        Number taskStart,
        Number taskEnd,
        String conversationId,
        Number bonusAmount,
        String bonusText,
        Boolean bonusPaid,
        String notes,
        String workerId,
        String assignmentId,
        String runId,
        String onboardingId,
        Number extraBonusAmount,
        String extraBonusText
) {
}
