package com.bridgesentinel.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Estimator settings loaded from the {@code model} section of the pipeline
 * configuration.
 *
 * <p>
 * Supported estimator types:
 * </p>
 * <ul>
 * <li>{@code isolation-forest}: ensemble of isolation trees (default)</li>
 * <li>{@code z-score}: largest absolute standardized deviation</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ModelSettings {

    public static final String TYPE_ISOLATION_FOREST = "isolation-forest";
    public static final String TYPE_Z_SCORE = "z-score";

    /** Estimator type. */
    private String type = TYPE_ISOLATION_FOREST;

    /** Expected fraction of anomalies in the training data. */
    private double contamination = 0.05;

    /** Number of trees in the ensemble (isolation forest only). */
    private int trees = 200;

    /** Rows drawn per tree (isolation forest only). */
    private int sampleSize = 256;

    /** Seed for every random choice made while fitting. */
    private long seed = 42L;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the settings for the declared estimator type.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (type == null || type.isBlank()) {
            errors.add("Model 'type' is required");
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            errors.add("Model 'contamination' must be in (0, 0.5], got: " + contamination);
        }

        if (type != null) {
            switch (type.toLowerCase(Locale.ROOT)) {
                case TYPE_ISOLATION_FOREST -> {
                    if (trees < 1) {
                        errors.add("Isolation forest requires 'trees' >= 1, got: " + trees);
                    }
                    if (sampleSize < 2) {
                        errors.add("Isolation forest requires 'sampleSize' >= 2, got: " + sampleSize);
                    }
                }
                case TYPE_Z_SCORE -> {
                    // contamination is the only parameter
                }
                default -> errors.add("Unknown model type: '" + type
                        + "'. Supported: " + TYPE_ISOLATION_FOREST + ", " + TYPE_Z_SCORE);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid model settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    /**
     * Set the estimator type, normalised to lowercase.
     *
     * @param type estimator type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelSettings that))
            return false;
        return Double.compare(contamination, that.contamination) == 0
                && trees == that.trees
                && sampleSize == that.sampleSize
                && seed == that.seed
                && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, contamination, trees, sampleSize, seed);
    }

    @Override
    public String toString() {
        return "ModelSettings{" +
                "type='" + type + '\'' +
                ", contamination=" + contamination +
                ", trees=" + trees +
                ", sampleSize=" + sampleSize +
                ", seed=" + seed +
                '}';
    }
}
