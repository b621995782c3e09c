package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.model.Outcome;

import java.util.List;

/**
 * Contract for a fitted scoring model.
 *
 * <p>
 * Implementations are <strong>immutable</strong> after fitting and
 * {@link #scoreBatch(List)} is a pure function of the fitted state and its
 * input, so one instance can be shared by every scoring cycle.
 * </p>
 */
public interface ScoringModel {

    /**
     * Score a batch of raw feature rows.
     *
     * @param rawRows feature rows in the configured column order; absent values
     *                are NaN
     * @return one outcome per row, positionally aligned with {@code rawRows}
     * @throws IllegalArgumentException if a row has the wrong width
     */
    List<Outcome> scoreBatch(List<double[]> rawRows);

    /**
     * @return number of features every row must carry
     */
    int featureCount();
}
