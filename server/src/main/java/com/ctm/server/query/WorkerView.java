package com.ctm.server.query;

import com.ctm.store.merge.MergedAssignmentView;
import com.ctm.store.model.WorkerRecord;

import java.util.List;

/** Body of {@code GET /workers/{id}}. */
public record WorkerView(WorkerRecord workerDetails, List<MergedAssignmentView> assignments) {
}
