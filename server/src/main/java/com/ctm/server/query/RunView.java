package com.ctm.server.query;

import com.ctm.store.merge.MergedAssignmentView;
import com.ctm.store.model.HitRecord;

import java.util.List;

/** Body of {@code GET /runs/{id}}. */
public record RunView(RunDetails runDetails, List<MergedAssignmentView> assignments, List<HitRecord> hits) {
}
