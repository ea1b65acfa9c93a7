package com.ctm.store.merge;

/**
 * A pairing that referenced an assignment absent from the assignment set.
 *
 * @param assignmentId the dangling reference (may be null if the pairing had none)
 * @param context      label of the view being assembled, e.g. {@code "run r-17"}
 */
public record MergeDiagnostic(String assignmentId, String context) {

    public String message() {
        return "assignment " + assignmentId + " missing from assignment table for " + context;
    }
}
