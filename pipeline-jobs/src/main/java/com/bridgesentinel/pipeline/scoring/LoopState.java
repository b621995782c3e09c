package com.bridgesentinel.pipeline.scoring;

/**
 * Lifecycle of the {@link ScoringLoop}.
 */
public enum LoopState {

    /** Store reachable; cycles score normally. */
    CONNECTED,

    /** The last cycle lost the store; each cycle retries and reconnects on failure. */
    RECONNECTING,

    /** Shutdown observed; releasing the store. */
    STOPPING,

    /** Store closed and final totals logged. */
    STOPPED
}
