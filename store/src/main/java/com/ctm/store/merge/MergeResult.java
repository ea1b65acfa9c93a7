package com.ctm.store.merge;

import java.util.List;

public record MergeResult(List<MergedAssignmentView> assignments, List<MergeDiagnostic> diagnostics) {

    public MergeResult {
        assignments = List.copyOf(assignments);
        diagnostics = List.copyOf(diagnostics);
    }
}
