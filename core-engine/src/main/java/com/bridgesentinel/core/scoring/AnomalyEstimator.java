package com.bridgesentinel.core.scoring;

/**
 * Contract for anomaly estimators.
 *
 * <p>
 * An estimator is a recipe: {@link #fit(double[][])} consumes the standardized
 * training matrix and returns an immutable {@link FittedEstimator}. The recipe
 * itself holds only configuration and may be reused.
 * </p>
 *
 * <p>
 * Fitting must be deterministic for a fixed seed so that a restarted scoring
 * process reproduces the same model from the same snapshot.
 * </p>
 */
public interface AnomalyEstimator {

    /**
     * Fit on the standardized training matrix.
     *
     * @param standardized training rows after imputation and scaling
     * @return the fitted estimator
     */
    FittedEstimator fit(double[][] standardized);

    /**
     * Return the estimator type name used in configuration and logs.
     *
     * @return type name
     */
    String getName();
}
