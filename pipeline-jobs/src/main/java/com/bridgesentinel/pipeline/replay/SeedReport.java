package com.bridgesentinel.pipeline.replay;

/**
 * Counts from one seeding run.
 *
 * @since 1.0.0
 */
public final class SeedReport {

    private final int trainingRows;
    private final int replayRows;
    private final int inserted;
    private final long storedAfter;
    private final long pendingAfter;
    private final boolean skipped;

    private SeedReport(int trainingRows, int replayRows, int inserted,
            long storedAfter, long pendingAfter, boolean skipped) {
        this.trainingRows = trainingRows;
        this.replayRows = replayRows;
        this.inserted = inserted;
        this.storedAfter = storedAfter;
        this.pendingAfter = pendingAfter;
        this.skipped = skipped;
    }

    static SeedReport completed(int trainingRows, int replayRows, int inserted,
            long storedAfter, long pendingAfter) {
        return new SeedReport(trainingRows, replayRows, inserted, storedAfter, pendingAfter, false);
    }

    static SeedReport skipped(int trainingRows, int replayRows, long stored) {
        return new SeedReport(trainingRows, replayRows, 0, stored, -1, true);
    }

    public int getTrainingRows() {
        return trainingRows;
    }

    public int getReplayRows() {
        return replayRows;
    }

    public int getInserted() {
        return inserted;
    }

    public long getStoredAfter() {
        return storedAfter;
    }

    /**
     * @return records awaiting scoring after the run, or -1 when skipped
     */
    public long getPendingAfter() {
        return pendingAfter;
    }

    /**
     * @return {@code true} if the store already held records and clearing
     *         was not requested
     */
    public boolean isSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return "SeedReport{trainingRows=" + trainingRows + ", replayRows=" + replayRows
                + ", inserted=" + inserted + ", storedAfter=" + storedAfter
                + ", pendingAfter=" + pendingAfter + ", skipped=" + skipped + '}';
    }
}
