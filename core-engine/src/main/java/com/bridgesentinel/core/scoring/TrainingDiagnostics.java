package com.bridgesentinel.core.scoring;

/**
 * Operator-facing statistics from scoring the training set with the freshly
 * fitted model. Informational only; nothing downstream depends on them.
 *
 * @since 1.0.0
 */
public final class TrainingDiagnostics {

    private final int rows;
    private final int anomalies;
    private final double minScore;
    private final double maxScore;

    public TrainingDiagnostics(int rows, int anomalies, double minScore, double maxScore) {
        this.rows = rows;
        this.anomalies = anomalies;
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public int getRows() {
        return rows;
    }

    public int getAnomalies() {
        return anomalies;
    }

    /**
     * @return percentage of training rows labelled anomalous
     */
    public double getAnomalyPercent() {
        return rows == 0 ? 0.0 : anomalies * 100.0 / rows;
    }

    public double getMinScore() {
        return minScore;
    }

    public double getMaxScore() {
        return maxScore;
    }

    @Override
    public String toString() {
        return String.format("TrainingDiagnostics{rows=%d, anomalies=%d (%.1f%%), score range=[%.4f, %.4f]}",
                rows, anomalies, getAnomalyPercent(), minScore, maxScore);
    }
}
