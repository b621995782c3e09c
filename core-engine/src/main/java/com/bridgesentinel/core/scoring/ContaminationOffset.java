package com.bridgesentinel.core.scoring;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Turns raw training scores into a decision threshold.
 *
 * <p>
 * The offset is the {@code contamination} quantile of the raw training scores
 * (linear interpolation), so subtracting it leaves roughly that fraction of
 * training rows with a negative decision value.
 * </p>
 */
final class ContaminationOffset {

    private ContaminationOffset() {
    }

    static double of(double[] rawTrainingScores, double contamination) {
        if (rawTrainingScores.length == 0) {
            throw new IllegalArgumentException("No training scores to derive an offset from");
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(rawTrainingScores, contamination * 100.0);
    }
}
