package com.ctm.store.merge;

import com.ctm.protocol.JsonMessages;
import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.PairingRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RecordMergerTest {

    private static AssignmentRecord assignment(String id, String workerId) {
        return new AssignmentRecord(id, "Completed", null, workerId, "hit-" + id);
    }

    private static PairingRecord pairing(String assignmentId, String status) {
        return new PairingRecord(status, 10L, 20L, 30L, 40L, "conv-" + assignmentId, 5L, "thanks",
                false, null, null, assignmentId, "run-1", "onb-" + assignmentId, null, null);
    }

    @Test
    void pairingStatusBecomesWorldStatus() {
        MergeResult result = RecordMerger.merge(
                List.of(new AssignmentRecord("a1", null, null, "w1", null)),
                List.of(pairing("a1", "done")),
                "run r1");

        assertEquals(1, result.assignments().size());
        MergedAssignmentView view = result.assignments().get(0);
        assertEquals("a1", view.assignmentId());
        assertEquals("w1", view.workerId());
        assertEquals("done", view.worldStatus());
        assertNull(view.status(), "assignment status is not touched by the pairing");
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void mergedViewSerializesToExactlyTheOverlaidKeys() throws Exception {
        PairingRecord statusOnly = new PairingRecord("done", null, null, null, null, null, null, null,
                null, null, null, "a1", null, null, null, null);
        MergeResult result = RecordMerger.merge(
                List.of(new AssignmentRecord("a1", null, null, "w1", null)),
                List.of(statusOnly),
                "run r1");

        String json = JsonMessages.toJson(result.assignments());

        assertEquals(JsonMessages.mapper().readTree("[{\"assignment_id\":\"a1\",\"worker_id\":\"w1\",\"world_status\":\"done\"}]"),
                JsonMessages.mapper().readTree(json));
    }

    @Test
    void orphanPairingIsDroppedWithOneDiagnostic() {
        MergeResult result = RecordMerger.merge(List.of(), List.of(pairing("a9", "done")), "worker w3");

        assertTrue(result.assignments().isEmpty());
        assertEquals(1, result.diagnostics().size());
        MergeDiagnostic d = result.diagnostics().get(0);
        assertEquals("a9", d.assignmentId());
        assertEquals("worker w3", d.context());
        assertTrue(d.message().contains("a9"));
    }

    @Test
    void oneDiagnosticPerOrphanPairing() {
        MergeResult result = RecordMerger.merge(
                List.of(assignment("a1", "w1")),
                List.of(pairing("a1", "done"), pairing("x1", "done"), pairing("x2", "failed"), pairing(null, "done")),
                "run r1");

        assertEquals(1, result.assignments().size());
        List<String> orphans = result.diagnostics().stream().map(MergeDiagnostic::assignmentId).toList();
        assertEquals(3, orphans.size());
        assertTrue(orphans.containsAll(List.of("x1", "x2")));
    }

    @Test
    void unpairedAssignmentsAppearUnmodified() {
        AssignmentRecord a1 = assignment("a1", "w1");
        AssignmentRecord a2 = assignment("a2", "w2");

        MergeResult result = RecordMerger.merge(List.of(a1, a2), List.of(pairing("a1", "done")), "run r1");

        assertEquals(MergedAssignmentView.of(a2), result.assignments().get(1));
        assertEquals(List.of("a1", "a2"),
                result.assignments().stream().map(MergedAssignmentView::assignmentId).toList(),
                "assignment input order is kept");
    }

    @Test
    void outputKeysAreASubsetOfAssignmentKeys() {
        List<AssignmentRecord> assignments = new ArrayList<>();
        List<PairingRecord> pairings = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            assignments.add(assignment("a" + i, "w" + (i % 7)));
            if (i % 3 == 0) pairings.add(pairing("a" + i, "done"));
            if (i % 5 == 0) pairings.add(pairing("orphan" + i, "done"));
        }

        MergeResult result = RecordMerger.merge(assignments, pairings, "run r1");

        Set<String> inputKeys = assignments.stream().map(AssignmentRecord::assignmentId).collect(Collectors.toSet());
        Set<String> outputKeys = result.assignments().stream().map(MergedAssignmentView::assignmentId)
                .collect(Collectors.toSet());
        assertEquals(inputKeys, outputKeys);
        assertEquals(10, result.diagnostics().size());
    }

    @Test
    void mergeIsDeterministicRegardlessOfPairingOrder() {
        List<AssignmentRecord> assignments = List.of(assignment("a1", "w1"), assignment("a2", "w1"), assignment("a3", "w2"));
        List<PairingRecord> pairings = new ArrayList<>(List.of(
                pairing("a1", "done"), pairing("a2", "disconnect"), pairing("a3", "expired")));

        MergeResult first = RecordMerger.merge(assignments, pairings, "run r1");
        MergeResult again = RecordMerger.merge(assignments, pairings, "run r1");
        assertEquals(first, again);

        Collections.shuffle(pairings, new Random(7));
        MergeResult shuffled = RecordMerger.merge(assignments, pairings, "run r1");
        assertEquals(first.assignments(), shuffled.assignments());
    }

    @Test
    void pairingWorkerIdOverlaysOnlyWhenPresent() {
        PairingRecord withWorker = new PairingRecord("done", null, null, null, null, null, null, null,
                null, null, "w9", "a1", "run-1", null, null, null);

        MergedAssignmentView kept = RecordMerger.merge(List.of(assignment("a1", "w1")),
                List.of(pairing("a1", "done")), "run r1").assignments().get(0);
        MergedAssignmentView replaced = RecordMerger.merge(List.of(assignment("a1", "w1")),
                List.of(withWorker), "run r1").assignments().get(0);

        assertEquals("w1", kept.workerId());
        assertEquals("w9", replaced.workerId());
    }

    @Test
    void laterPairingForTheSameAssignmentWins() {
        MergeResult result = RecordMerger.merge(
                List.of(assignment("a1", "w1")),
                List.of(pairing("a1", "onboarding"), pairing("a1", "done")),
                "run r1");

        assertEquals(1, result.assignments().size());
        assertEquals("done", result.assignments().get(0).worldStatus());
    }
}
