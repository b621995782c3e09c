package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.config.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyEstimator} instances from
 * {@link ModelSettings}.
 *
 * <p>
 * This is the single point of extension when adding new estimator types:
 * register the new type string here and implement the estimator.
 * </p>
 *
 * @since 1.0.0
 */
public final class EstimatorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EstimatorFactory.class);

    private EstimatorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the estimator for the given settings.
     *
     * @param settings model settings; must not be {@code null}
     * @return an appropriate {@link AnomalyEstimator}
     * @throws NullPointerException     if {@code settings} or its type is {@code null}
     * @throws IllegalArgumentException if the type is unknown
     */
    public static AnomalyEstimator create(ModelSettings settings) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        Objects.requireNonNull(settings.getType(), "Model type must not be null");

        String type = settings.getType().toLowerCase(Locale.ROOT);
        AnomalyEstimator estimator = switch (type) {
            case ModelSettings.TYPE_ISOLATION_FOREST -> new IsolationForest(settings);
            case ModelSettings.TYPE_Z_SCORE -> new ZScoreEstimator(settings);
            default -> throw new IllegalArgumentException(
                    "Unknown estimator type: '" + settings.getType()
                            + "'. Supported types: " + ModelSettings.TYPE_ISOLATION_FOREST
                            + ", " + ModelSettings.TYPE_Z_SCORE);
        };
        LOG.debug("Created estimator {} from {}", estimator.getName(), settings);
        return estimator;
    }
}
