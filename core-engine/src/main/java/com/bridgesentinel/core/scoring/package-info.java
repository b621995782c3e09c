/**
 * Pluggable scoring model.
 *
 * <p>
 * {@link com.bridgesentinel.core.scoring.ModelTrainer} fits a
 * {@link com.bridgesentinel.core.scoring.FittedScoringModel}: a
 * {@link com.bridgesentinel.core.scoring.MedianImputer}, a
 * {@link com.bridgesentinel.core.scoring.StandardScaler} and a fitted
 * {@link com.bridgesentinel.core.scoring.AnomalyEstimator}. Built-in
 * estimator types:
 * </p>
 * <ul>
 * <li>{@link com.bridgesentinel.core.scoring.IsolationForest}: random
 * isolation trees</li>
 * <li>{@link com.bridgesentinel.core.scoring.ZScoreEstimator}: largest
 * absolute standardized deviation</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an estimator, implement {@code AnomalyEstimator} and register its
 * type string in {@code EstimatorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.core.scoring;
