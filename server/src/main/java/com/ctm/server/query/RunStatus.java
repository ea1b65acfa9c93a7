package com.ctm.server.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall state of a run as shown on the dashboard.
 *
 * Only the sentinel exists so far: how a run's status should be derived from its HITs
 * and assignments has not been decided, so nothing is computed.
 */
public enum RunStatus {
    NOT_COMPUTED("not_computed");

    private final String wireValue;

    RunStatus(String wireValue) { this.wireValue = wireValue; }

    @JsonValue
    public String wireValue() { return wireValue; }
}
