package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.config.ModelSettings;

import java.util.Objects;

/**
 * Baseline estimator on the standardized feature space.
 *
 * <p>
 * The raw score of a row is the negative of its largest absolute standardized
 * deviation across features, so a row that is extreme in any single channel
 * scores low. The decision offset is the contamination quantile of the raw
 * training scores, as for the isolation forest.
 * </p>
 *
 * <p>
 * This estimator is <strong>stateless</strong> beyond its offset and needs no
 * random source.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreEstimator implements AnomalyEstimator {

    private final double contamination;

    public ZScoreEstimator(ModelSettings settings) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        this.contamination = settings.getContamination();
    }

    @Override
    public FittedEstimator fit(double[][] standardized) {
        Matrices.width(standardized);
        double[] raw = new double[standardized.length];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = rawScore(standardized[i]);
        }
        double offset = ContaminationOffset.of(raw, contamination);
        return x -> rawScore(x) - offset;
    }

    @Override
    public String getName() {
        return ModelSettings.TYPE_Z_SCORE;
    }

    static double rawScore(double[] x) {
        double worst = 0.0;
        for (double v : x) {
            worst = Math.max(worst, Math.abs(v));
        }
        return -worst;
    }
}
