package com.bridgesentinel.core.model;

import java.util.Objects;

/**
 * The scoring result assigned to a telemetry record exactly once.
 *
 * <p>
 * {@code anomaly} is the authoritative label. {@code score} is the raw
 * decision value of the estimator, kept for diagnostics: lower is more
 * anomalous and negative values correspond to the anomalous label.
 * </p>
 *
 * @since 1.0.0
 */
public final class Outcome {

    private final boolean anomaly;
    private final double score;

    public Outcome(boolean anomaly, double score) {
        this.anomaly = anomaly;
        this.score = score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Outcome that))
            return false;
        return anomaly == that.anomaly && Double.compare(score, that.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomaly, score);
    }

    @Override
    public String toString() {
        return "Outcome{anomaly=" + anomaly + ", score=" + score + '}';
    }
}
