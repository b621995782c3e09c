package com.bridgesentinel.pipeline.scoring;

/**
 * What a single scoring cycle did.
 *
 * @since 1.0.0
 */
public final class CycleResult {

    /**
     * Outcome kind of a cycle.
     */
    public enum Kind {
        SCORED, IDLE, CONNECTION_LOST, FAILED
    }

    private final long cycle;
    private final Kind kind;
    private final int scored;
    private final int anomalies;

    private CycleResult(long cycle, Kind kind, int scored, int anomalies) {
        this.cycle = cycle;
        this.kind = kind;
        this.scored = scored;
        this.anomalies = anomalies;
    }

    static CycleResult scored(long cycle, int scored, int anomalies) {
        return new CycleResult(cycle, Kind.SCORED, scored, anomalies);
    }

    static CycleResult idle(long cycle) {
        return new CycleResult(cycle, Kind.IDLE, 0, 0);
    }

    static CycleResult connectionLost(long cycle) {
        return new CycleResult(cycle, Kind.CONNECTION_LOST, 0, 0);
    }

    static CycleResult failed(long cycle) {
        return new CycleResult(cycle, Kind.FAILED, 0, 0);
    }

    public long getCycle() {
        return cycle;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return outcomes written by this cycle
     */
    public int getScored() {
        return scored;
    }

    /**
     * @return anomalous outcomes in this cycle's batch
     */
    public int getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "CycleResult{cycle=" + cycle + ", kind=" + kind
                + ", scored=" + scored + ", anomalies=" + anomalies + '}';
    }
}
