package com.bridgesentinel.core.scoring;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Centres every feature on its training mean and divides by its training
 * (population) standard deviation.
 *
 * <p>
 * A constant feature has a deviation of zero; its scale is set to {@code 1}
 * so the transformed value is simply the offset from the mean.
 * </p>
 *
 * @since 1.0.0
 */
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    private StandardScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    /**
     * @param rows imputed training rows (no absent values); must not be empty
     * @return the fitted scaler
     */
    public static StandardScaler fit(double[][] rows) {
        int width = Matrices.width(rows);
        Mean mean = new Mean();
        StandardDeviation deviation = new StandardDeviation(false);
        double[] means = new double[width];
        double[] scales = new double[width];
        for (int j = 0; j < width; j++) {
            double[] column = Matrices.column(rows, j);
            means[j] = mean.evaluate(column);
            double sd = deviation.evaluate(column);
            scales[j] = sd > 0.0 ? sd : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    /**
     * @param row imputed feature row
     * @return a new standardized row
     * @throws IllegalArgumentException if the row width does not match
     */
    public double[] transform(double[] row) {
        Matrices.requireWidth(row, means.length);
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - means[j]) / scales[j];
        }
        return out;
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getScales() {
        return scales.clone();
    }

    @Override
    public String toString() {
        return "StandardScaler{means=" + Arrays.toString(means)
                + ", scales=" + Arrays.toString(scales) + '}';
    }
}
