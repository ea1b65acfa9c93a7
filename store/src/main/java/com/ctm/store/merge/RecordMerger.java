package com.ctm.store.merge;

import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.PairingRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles assignments with pairings into one view per assignment.
 *
 * The assignment set defines the output key set: a pairing whose assignment id is not
 * among the assignments is skipped and reported as a {@link MergeDiagnostic}, never
 * raised. Output keeps assignment input order. When several pairings name the same
 * assignment they are applied in input order, so the last one wins.
 *
 * Pure: no I/O, no shared state. Callers decide how to report the diagnostics.
 */
public final class RecordMerger {

    private RecordMerger() {}

    public static MergeResult merge(List<AssignmentRecord> assignments,
                                    List<PairingRecord> pairings,
                                    String context) {
        Map<String, MergedAssignmentView> byId = new LinkedHashMap<>();
        for (AssignmentRecord a : assignments) {
            byId.put(a.assignmentId(), MergedAssignmentView.of(a));
        }

        List<MergeDiagnostic> diagnostics = new ArrayList<>();
        for (PairingRecord p : pairings) {
            String id = p.assignmentId();
            MergedAssignmentView existing = id != null ? byId.get(id) : null;
            if (existing == null) {
                diagnostics.add(new MergeDiagnostic(id, context));
                continue;
            }
            byId.put(id, existing.overlay(p));
        }
        return new MergeResult(new ArrayList<>(byId.values()), diagnostics);
    }
}
