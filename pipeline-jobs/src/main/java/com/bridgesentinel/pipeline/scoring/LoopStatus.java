package com.bridgesentinel.pipeline.scoring;

import java.time.Instant;

/**
 * Immutable snapshot of the scoring loop, safe to read from any thread.
 *
 * @since 1.0.0
 */
public final class LoopStatus {

    private final LoopState state;
    private final long cycle;
    private final long totalScored;
    private final long totalAnomalies;
    private final long reconnectAttempts;
    private final Instant lastBatchAt;

    public LoopStatus(LoopState state, long cycle, long totalScored, long totalAnomalies,
            long reconnectAttempts, Instant lastBatchAt) {
        this.state = state;
        this.cycle = cycle;
        this.totalScored = totalScored;
        this.totalAnomalies = totalAnomalies;
        this.reconnectAttempts = reconnectAttempts;
        this.lastBatchAt = lastBatchAt;
    }

    public LoopState getState() {
        return state;
    }

    public long getCycle() {
        return cycle;
    }

    public long getTotalScored() {
        return totalScored;
    }

    public long getTotalAnomalies() {
        return totalAnomalies;
    }

    public long getReconnectAttempts() {
        return reconnectAttempts;
    }

    /**
     * @return when the last batch was persisted, or {@code null} before the
     *         first one
     */
    public Instant getLastBatchAt() {
        return lastBatchAt;
    }

    @Override
    public String toString() {
        return "LoopStatus{state=" + state + ", cycle=" + cycle + ", totalScored=" + totalScored
                + ", totalAnomalies=" + totalAnomalies + ", reconnectAttempts=" + reconnectAttempts
                + ", lastBatchAt=" + lastBatchAt + '}';
    }
}
