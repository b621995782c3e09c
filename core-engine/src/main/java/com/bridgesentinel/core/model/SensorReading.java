package com.bridgesentinel.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One full row of bridge telemetry as it appears in the historical dataset.
 *
 * <p>
 * Rows carry dozens of columns (structural, environmental, load, health) of
 * which only a configured subset feeds the scoring model. The row is therefore
 * kept as an ordered column map so every column can be written back to the
 * store unchanged, while {@link #featureVector(List)} extracts the model input.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Readings are built by a single reader thread and handed
 * over to the inserting thread without further mutation.
 * </p>
 *
 * @since 1.0.0
 */
public class SensorReading {

    /** Column name to value, in source column order. Values are Double, String or null. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Observation time; replaced by insertion time when a row is replayed. */
    private Instant observedAt;

    public SensorReading() {
    }

    /**
     * Copy constructor.
     *
     * @param other reading to copy; must not be {@code null}
     */
    public SensorReading(SensorReading other) {
        Objects.requireNonNull(other, "Reading must not be null");
        this.fields.putAll(other.fields);
        this.observedAt = other.observedAt;
    }

    // ---------------------------------------------------------------
    // Fields
    // ---------------------------------------------------------------

    /**
     * Set a column value. {@code null} marks the value as absent.
     *
     * @param column column name; must not be {@code null}
     * @param value  the value
     * @throws NullPointerException if {@code column} is {@code null}
     */
    public void setField(String column, Object value) {
        Objects.requireNonNull(column, "Column name must not be null");
        fields.put(column, value);
    }

    /**
     * @return unmodifiable view of every column, in insertion order
     */
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String column) {
        return Optional.ofNullable(fields.get(column));
    }

    /**
     * Retrieve a numeric column value.
     *
     * <p>
     * {@link Number} values are used as-is and strings are parsed. NaN and
     * infinite values count as absent.
     * </p>
     *
     * @param column the column name
     * @return the finite value, or empty
     */
    public Optional<Double> getNumericField(String column) {
        Object raw = fields.get(column);
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * Build the model input for this reading.
     *
     * @param featureColumns ordered feature column names
     * @return one slot per column; absent values are {@link Double#NaN}
     */
    public double[] featureVector(List<String> featureColumns) {
        double[] vector = new double[featureColumns.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = getNumericField(featureColumns.get(i)).orElse(Double.NaN);
        }
        return vector;
    }

    /**
     * Return a copy of this reading with the given columns removed.
     *
     * @param columns columns to drop
     * @return a new reading
     */
    public SensorReading without(Collection<String> columns) {
        SensorReading copy = new SensorReading(this);
        columns.forEach(copy.fields::remove);
        return copy;
    }

    // ---------------------------------------------------------------
    // Observation time
    // ---------------------------------------------------------------

    /**
     * @return the observation time, or {@code null} if not known
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    public void setObservedAt(Instant observedAt) {
        this.observedAt = observedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorReading that))
            return false;
        return Objects.equals(fields, that.fields) && Objects.equals(observedAt, that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, observedAt);
    }

    @Override
    public String toString() {
        return "SensorReading{observedAt=" + observedAt + ", fields=" + fields + '}';
    }
}
