package com.ctm.server.query;

import com.ctm.store.RecordStore;
import com.ctm.store.merge.MergeDiagnostic;
import com.ctm.store.merge.MergedAssignmentView;
import com.ctm.store.merge.MergeResult;
import com.ctm.store.merge.RecordMerger;
import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.HitRecord;
import com.ctm.store.model.PairingRecord;
import com.ctm.store.model.RunRecord;
import com.ctm.store.model.WorkerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views for the HTTP surface, assembled from the record store.
 *
 * Reads are not transactional: a view may combine rows written between its queries.
 * Merge diagnostics are logged as data-integrity warnings and never reach the caller.
 */
public final class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final RecordStore store;

    public QueryService(RecordStore store) {
        this.store = store;
    }

    public List<RunRecord> listRuns() {
        return store.getAllRuns();
    }

    public List<WorkerRecord> listWorkers() {
        return store.getAllWorkers();
    }

    public Optional<RunView> runView(String runId) {
        Optional<RunRecord> run = store.getRun(runId);
        if (run.isEmpty()) return Optional.empty();

        List<HitRecord> hits = store.getHitsForRun(runId);
        List<MergedAssignmentView> assignments = merged(
                store.getAssignmentsForRun(runId), store.getPairingsForRun(runId), "run " + runId);
        return Optional.of(new RunView(RunDetails.of(run.get()), assignments, hits));
    }

    public Optional<WorkerView> workerView(String workerId) {
        Optional<WorkerRecord> worker = store.getWorker(workerId);
        if (worker.isEmpty()) return Optional.empty();

        List<MergedAssignmentView> assignments = merged(
                store.getAssignmentsForWorker(workerId), store.getPairingsForWorker(workerId), "worker " + workerId);
        return Optional.of(new WorkerView(worker.get(), assignments));
    }

    private static List<MergedAssignmentView> merged(List<AssignmentRecord> assignments,
                                                     List<PairingRecord> pairings,
                                                     String context) {
        MergeResult result = RecordMerger.merge(assignments, pairings, context);
        for (MergeDiagnostic d : result.diagnostics()) {
            log.warn("Data integrity: {}", d.message());
        }
        return result.assignments();
    }
}
