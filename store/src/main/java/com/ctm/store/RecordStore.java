package com.ctm.store;

import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.HitRecord;
import com.ctm.store.model.PairingRecord;
import com.ctm.store.model.RunRecord;
import com.ctm.store.model.WorkerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to recorded runs, HITs, assignments, workers and pairings.
 *
 * Lists come back in store-defined order. Implementations throw {@link StoreException}
 * when the backing store cannot be read.
 */
public interface RecordStore {

    List<RunRecord> getAllRuns();

    Optional<RunRecord> getRun(String runId);

    List<WorkerRecord> getAllWorkers();

    Optional<WorkerRecord> getWorker(String workerId);

    List<HitRecord> getHitsForRun(String runId);

    List<AssignmentRecord> getAssignmentsForRun(String runId);

    List<PairingRecord> getPairingsForRun(String runId);

    List<AssignmentRecord> getAssignmentsForWorker(String workerId);

    List<PairingRecord> getPairingsForWorker(String workerId);
}
