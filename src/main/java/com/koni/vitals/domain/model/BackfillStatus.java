package com.koni.vitals.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a site backfill.
 * Legal transitions: NOT_STARTED to IN_PROGRESS, IN_PROGRESS to COMPLETE or ERROR.
 * Leaving COMPLETE or ERROR requires a reset, which creates a new state.
 */
public enum BackfillStatus {
    
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    ERROR("error");
    
    private final String wireValue;
    
    BackfillStatus(String wireValue) {
        this.wireValue = wireValue;
    }
    
    @JsonValue
    public String wireValue() {
        return wireValue;
    }
    
    @JsonCreator
    public static BackfillStatus fromWireValue(String value) {
        for (BackfillStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown backfill status: " + value);
    }
    
    public boolean canTransitionTo(BackfillStatus next) {
        switch (this) {
            case NOT_STARTED:
                return next == IN_PROGRESS;
            case IN_PROGRESS:
                return next == COMPLETE || next == ERROR;
            default:
                return false;
        }
    }
    
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
