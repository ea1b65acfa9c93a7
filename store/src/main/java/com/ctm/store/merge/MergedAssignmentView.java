package com.ctm.store.merge;

import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.PairingRecord;

/**
 * An assignment with the fields of its pairing laid over it.
 *
 * The pairing's {@code status} is carried as {@code worldStatus} so it cannot be
 * confused with the assignment-level {@code status}. Pairing fields are null until
 * {@link #overlay(PairingRecord)} is applied.
 */
public record MergedAssignmentView(
        // assignment
        String assignmentId,
        String status,
        Number approveTime,
        String workerId,
        String hitId,
        // pairing
        String worldStatus,
        Number onboardingStart,
        Number onboardingEnd,
        Number taskStart,
        Number taskEnd,
        String conversationId,
        Number bonusAmount,
        String bonusText,
        Boolean bonusPaid,
        String notes,
        String runId,
        String onboardingId,
        Number extraBonusAmount,
        String extraBonusText
) {

    public static MergedAssignmentView of(AssignmentRecord a) {
        return new MergedAssignmentView(
                a.assignmentId(), a.status(), a.approveTime(), a.workerId(), a.hitId(),
                null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with every pairing field applied. The assignment id is kept;
     * the worker id is replaced only when the pairing carries one.
     */
    public MergedAssignmentView overlay(PairingRecord p) {
        return new MergedAssignmentView(
                assignmentId,
                status,
                approveTime,
                p.workerId() != null ? p.workerId() : workerId,
                hitId,
                p.status(),
                p.onboardingStart(),
                p.onboardingEnd(),
                p.taskStart(),
                p.taskEnd(),
                p.conversationId(),
                p.bonusAmount(),
                p.bonusText(),
                p.bonusPaid(),
                p.notes(),
                p.runId(),
                p.onboardingId(),
                p.extraBonusAmount(),
                p.extraBonusText());
    }
}
