package com.bridgesentinel.core.scoring;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * Replaces absent feature values with the per-feature training median.
 *
 * <p>
 * A value is absent when it is NaN or infinite. A feature that is absent in
 * every training row imputes to {@code 0.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MedianImputer {

    private final double[] medians;

    private MedianImputer(double[] medians) {
        this.medians = medians;
    }

    /**
     * Compute per-feature medians over the present values of each column.
     *
     * @param rows training rows, all of the same width; must not be empty
     * @return the fitted imputer
     */
    public static MedianImputer fit(double[][] rows) {
        int width = Matrices.width(rows);
        Median median = new Median();
        double[] medians = new double[width];
        for (int j = 0; j < width; j++) {
            double[] present = Matrices.presentValues(rows, j);
            medians[j] = present.length == 0 ? 0.0 : median.evaluate(present);
        }
        return new MedianImputer(medians);
    }

    /**
     * @param row raw feature row
     * @return a new row with every absent value replaced
     * @throws IllegalArgumentException if the row width does not match
     */
    public double[] transform(double[] row) {
        Matrices.requireWidth(row, medians.length);
        double[] out = row.clone();
        for (int j = 0; j < out.length; j++) {
            if (!Double.isFinite(out[j])) {
                out[j] = medians[j];
            }
        }
        return out;
    }

    public double[] getMedians() {
        return medians.clone();
    }

    @Override
    public String toString() {
        return "MedianImputer{medians=" + Arrays.toString(medians) + '}';
    }
}
