package com.bridgesentinel.core.scoring;

/**
 * A fitted, immutable anomaly estimator.
 *
 * <p>
 * Implementations must be safe for concurrent use: they hold only state fixed
 * at fit time.
 * </p>
 */
public interface FittedEstimator {

    /**
     * Decision value for one standardized row. Lower is more anomalous; a
     * negative value means the row is an outlier.
     *
     * @param standardized the row after imputation and scaling
     * @return decision value
     */
    double decisionFunction(double[] standardized);

    /**
     * Native prediction: {@code true} when the row is an outlier.
     *
     * @param standardized the row after imputation and scaling
     * @return outlier flag
     */
    default boolean isOutlier(double[] standardized) {
        return decisionFunction(standardized) < 0.0;
    }
}
