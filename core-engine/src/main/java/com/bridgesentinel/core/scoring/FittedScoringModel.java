package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.model.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Imputation, standardization and a fitted estimator bundled into one
 * {@link ScoringModel}.
 *
 * <p>
 * Every row goes through the same three steps used at training time:
 * median imputation, scaling with the training statistics, and the
 * estimator's decision function.
 * </p>
 *
 * @since 1.0.0
 */
public final class FittedScoringModel implements ScoringModel {

    private final MedianImputer imputer;
    private final StandardScaler scaler;
    private final FittedEstimator estimator;
    private final int featureCount;

    public FittedScoringModel(MedianImputer imputer, StandardScaler scaler,
            FittedEstimator estimator, int featureCount) {
        this.imputer = Objects.requireNonNull(imputer, "imputer must not be null");
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
        if (featureCount < 1) {
            throw new IllegalArgumentException("featureCount must be >= 1, got: " + featureCount);
        }
        this.featureCount = featureCount;
    }

    @Override
    public List<Outcome> scoreBatch(List<double[]> rawRows) {
        Objects.requireNonNull(rawRows, "rows must not be null");
        List<Outcome> outcomes = new ArrayList<>(rawRows.size());
        for (double[] row : rawRows) {
            outcomes.add(score(row));
        }
        return outcomes;
    }

    /**
     * Score a single raw row.
     */
    public Outcome score(double[] rawRow) {
        double[] standardized = standardize(rawRow);
        double decision = estimator.decisionFunction(standardized);
        return new Outcome(decision < 0.0, decision);
    }

    double[] standardize(double[] rawRow) {
        return scaler.transform(imputer.transform(rawRow));
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    public MedianImputer getImputer() {
        return imputer;
    }

    public StandardScaler getScaler() {
        return scaler;
    }
}
