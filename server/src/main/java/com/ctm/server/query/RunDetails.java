package com.ctm.server.query;

import com.ctm.store.model.RunRecord;

public record RunDetails(
        String runId,
        long created,
        long maximum,
        long completed,
        long failed,
        String taskname,
        Number launchTime,
        RunStatus runStatus
) {

    public static RunDetails of(RunRecord run) {
        return new RunDetails(run.runId(), run.created(), run.maximum(), run.completed(), run.failed(),
                run.taskname(), run.launchTime(), RunStatus.NOT_COMPUTED);
    }
}
