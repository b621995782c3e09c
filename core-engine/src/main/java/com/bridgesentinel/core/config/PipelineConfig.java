package com.bridgesentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * table: bridge_dataset
 * timestampColumn: timestamp
 * featureColumns:
 *   - strain_microstrain
 *   - deflection_mm
 * model:
 *   type: isolation-forest
 *   contamination: 0.05
 *   trees: 200
 *   sampleSize: 256
 *   seed: 42
 * </pre>
 *
 * <p>
 * Table and column names end up in SQL text, so {@link #validate()} only
 * accepts lowercase SQL identifiers.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig {

    /** Outcome label column; always written by the scoring loop only. */
    public static final String ANOMALY_COLUMN = "is_anomaly";

    /** Outcome score column. */
    public static final String SCORE_COLUMN = "anomaly_score";

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private String table = "bridge_dataset";
    private String timestampColumn = "timestamp";
    private List<String> featureColumns = new ArrayList<>();
    private ModelSettings model = new ModelSettings();

    /**
     * @return the outcome columns a producer must never write
     */
    public static List<String> outcomeColumns() {
        return List.of(ANOMALY_COLUMN, SCORE_COLUMN);
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public void setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    /**
     * Return the feature column list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return ordered feature columns
     */
    public List<String> getFeatureColumns() {
        return Collections.unmodifiableList(featureColumns);
    }

    public void setFeatureColumns(List<String> featureColumns) {
        this.featureColumns = featureColumns != null ? new ArrayList<>(featureColumns) : new ArrayList<>();
    }

    public ModelSettings getModel() {
        return model;
    }

    public void setModel(ModelSettings model) {
        this.model = model != null ? model : new ModelSettings();
    }

    /**
     * Validate the whole configuration.
     *
     * <p>
     * Collects every error and throws a single exception listing all of them.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkIdentifier("table", table, errors);
        checkIdentifier("timestampColumn", timestampColumn, errors);

        if (featureColumns.isEmpty()) {
            errors.add("At least one feature column is required");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < featureColumns.size(); i++) {
            String column = featureColumns.get(i);
            checkIdentifier("featureColumns[" + i + "]", column, errors);
            if (column != null && !seen.add(column)) {
                errors.add("Duplicate feature column: '" + column + "'");
            }
            if (outcomeColumns().contains(column) || (column != null && column.equals(timestampColumn))) {
                errors.add("Feature column '" + column + "' clashes with a reserved column");
            }
        }

        try {
            model.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void checkIdentifier(String name, String value, List<String> errors) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            errors.add("'" + name + "' must be a lowercase SQL identifier, got: '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "table='" + table + '\'' +
                ", timestampColumn='" + timestampColumn + '\'' +
                ", featureColumns=" + featureColumns +
                ", model=" + model +
                '}';
    }
}
