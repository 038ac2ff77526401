package com.koni.vitals.domain.exception;

import com.koni.vitals.domain.model.BackfillStatus;
import lombok.Getter;

/**
 * Exception thrown when a backfill state change is not one of the legal transitions.
 */
@Getter
public class IllegalBackfillTransitionException extends RuntimeException {
    
    private final BackfillStatus from;
    private final BackfillStatus to;
    
    public IllegalBackfillTransitionException(BackfillStatus from, BackfillStatus to) {
        super("Illegal backfill transition: " + from.wireValue() + " -> " + to.wireValue());
        this.from = from;
        this.to = to;
    }
}
