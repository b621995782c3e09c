package com.bridgesentinel.core.model;

import java.util.Objects;

/**
 * An outcome addressed to one stored record.
 *
 * @since 1.0.0
 */
public final class OutcomeUpdate {

    private final long recordId;
    private final Outcome outcome;

    public OutcomeUpdate(long recordId, Outcome outcome) {
        this.recordId = recordId;
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public long getRecordId() {
        return recordId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutcomeUpdate that))
            return false;
        return recordId == that.recordId && outcome.equals(that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, outcome);
    }

    @Override
    public String toString() {
        return "OutcomeUpdate{recordId=" + recordId + ", outcome=" + outcome + '}';
    }
}
