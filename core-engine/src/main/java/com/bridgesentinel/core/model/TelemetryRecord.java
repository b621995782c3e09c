package com.bridgesentinel.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A stored telemetry record as seen by the scoring side.
 *
 * <p>
 * Only the store-assigned id, the ingestion time and the configured feature
 * channels are carried. Absent feature values are {@link Double#NaN}. A record
 * without an {@link Outcome} is <em>pending</em>.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetryRecord {

    private final long id;
    private final Instant observedAt;
    private final double[] features;
    private final Outcome outcome;

    public TelemetryRecord(long id, Instant observedAt, double[] features, Outcome outcome) {
        this.id = id;
        this.observedAt = observedAt;
        this.features = Objects.requireNonNull(features, "features must not be null").clone();
        this.outcome = outcome;
    }

    /**
     * Create a record that has not been scored yet.
     */
    public static TelemetryRecord pending(long id, Instant observedAt, double[] features) {
        return new TelemetryRecord(id, observedAt, features, null);
    }

    public long getId() {
        return id;
    }

    /**
     * @return ingestion time, or {@code null} if the store did not record one
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    /**
     * @return a copy of the feature vector
     */
    public double[] getFeatures() {
        return features.clone();
    }

    public Optional<Outcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public boolean isPending() {
        return outcome == null;
    }

    /**
     * Return this record with the given outcome attached.
     */
    public TelemetryRecord withOutcome(Outcome newOutcome) {
        return new TelemetryRecord(id, observedAt, features, newOutcome);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return id == that.id
                && Objects.equals(observedAt, that.observedAt)
                && Arrays.equals(features, that.features)
                && Objects.equals(outcome, that.outcome);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, observedAt, outcome) + Arrays.hashCode(features);
    }

    @Override
    public String toString() {
        return "TelemetryRecord{" +
                "id=" + id +
                ", observedAt=" + observedAt +
                ", features=" + Arrays.toString(features) +
                ", outcome=" + outcome +
                '}';
    }
}
