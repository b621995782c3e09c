package com.bridgesentinel.pipeline.replay;

/**
 * Counts from one feed producer run.
 *
 * @since 1.0.0
 */
public final class ReplayReport {

    private final int planned;
    private final int attempted;
    private final int succeeded;

    public ReplayReport(int planned, int attempted, int succeeded) {
        this.planned = planned;
        this.attempted = attempted;
        this.succeeded = succeeded;
    }

    /**
     * @return rows the run intended to send
     */
    public int getPlanned() {
        return planned;
    }

    public int getAttempted() {
        return attempted;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return attempted - succeeded;
    }

    /**
     * @return whether the run stopped before attempting every planned row
     */
    public boolean isInterrupted() {
        return attempted < planned;
    }

    @Override
    public String toString() {
        return "ReplayReport{planned=" + planned + ", attempted=" + attempted
                + ", succeeded=" + succeeded + '}';
    }
}
