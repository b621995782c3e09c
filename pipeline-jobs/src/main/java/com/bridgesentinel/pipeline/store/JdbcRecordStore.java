package com.bridgesentinel.pipeline.store;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.model.Outcome;
import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.TelemetryRecord;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.core.store.RecordStoreException;
import com.bridgesentinel.pipeline.JobSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link RecordStore} backed by a PostgreSQL table through a HikariCP pool.
 *
 * <p>
 * The table is expected to exist with an identity {@code id} column, the
 * configured timestamp and feature columns, and the outcome columns
 * {@code is_anomaly} / {@code anomaly_score}. A partial index on pending ids
 * keeps {@link #fetchPending(int)} cheap.
 * </p>
 *
 * <h3>Outcome guard</h3>
 * <p>
 * Every outcome update carries {@code AND is_anomaly IS NULL}, so an outcome
 * that is already present is never overwritten. Rows skipped by the guard
 * are logged and not counted as applied.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * {@link SQLException}s are translated by {@link SqlErrorClassifier}. The pool
 * is created lazily with {@code initializationFailTimeout = -1}; reachability
 * is checked explicitly by {@link #verifyConnection()}.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcRecordStore.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final JobSettings settings;
    private final String table;
    private final String timestampColumn;
    private final List<String> featureColumns;

    private final String fetchPendingSql;
    private final String snapshotSql;
    private final String updateOutcomeSql;

    private volatile HikariDataSource dataSource;

    /**
     * Create the pool and verify that the database is reachable.
     *
     * @throws com.bridgesentinel.core.store.StoreConnectionException if the
     *         database cannot be reached
     */
    public JdbcRecordStore(JobSettings settings, PipelineConfig config) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.table = quote(config.getTable());
        this.timestampColumn = config.getTimestampColumn();
        this.featureColumns = List.copyOf(config.getFeatureColumns());

        String features = featureColumns.stream().map(JdbcRecordStore::quote).collect(Collectors.joining(", "));
        String anomaly = quote(PipelineConfig.ANOMALY_COLUMN);
        this.fetchPendingSql = "SELECT \"id\", " + quote(timestampColumn) + ", " + features
                + " FROM " + table + " WHERE " + anomaly + " IS NULL ORDER BY \"id\" LIMIT ?";
        this.snapshotSql = "SELECT " + features + " FROM " + table + " ORDER BY \"id\"";
        this.updateOutcomeSql = "UPDATE " + table + " SET " + anomaly + " = ?, "
                + quote(PipelineConfig.SCORE_COLUMN) + " = ? WHERE \"id\" = ? AND " + anomaly + " IS NULL";

        this.dataSource = createDataSource();
        try {
            verifyConnection();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    // ---------------------------------------------------------------
    // Connection management
    // ---------------------------------------------------------------

    private HikariDataSource createDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.getJdbcUrl());
        config.setUsername(settings.getDbUser());
        config.setPassword(settings.getDbPassword());
        config.setMaximumPoolSize(settings.getPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(settings.getConnectTimeoutMs());
        config.setValidationTimeout(Math.min(3_000, settings.getConnectTimeoutMs()));
        config.setInitializationFailTimeout(-1);
        config.setPoolName("BridgeSentinelPool");
        return new HikariDataSource(config);
    }

    /**
     * Borrow a connection and check that it is valid.
     *
     * @throws com.bridgesentinel.core.store.StoreConnectionException if the
     *         database cannot be reached
     */
    public void verifyConnection() {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid((int) Math.max(1, settings.getConnectTimeoutMs() / 1000))) {
                throw new SQLException("Connection is not valid", "08006");
            }
            LOG.info("Connected to {}", settings.getJdbcUrl());
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Connect", e);
        }
    }

    @Override
    public synchronized void reconnect() {
        HikariDataSource old = dataSource;
        LOG.warn("Reconnecting to {}...", settings.getJdbcUrl());
        dataSource = createDataSource();
        if (old != null) {
            old.close();
        }
        verifyConnection();
    }

    @Override
    public synchronized void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            LOG.info("Record store connection closed");
        }
    }

    // ---------------------------------------------------------------
    // Inserts
    // ---------------------------------------------------------------

    @Override
    public long insert(SensorReading reading) {
        Objects.requireNonNull(reading, "reading must not be null");
        Row row = toRow(reading);
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(row.insertSql(table), new String[] { "id" })) {
            row.bind(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new RecordStoreException("Insert returned no generated id");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Insert", e);
        }
    }

    @Override
    public int insertAll(List<SensorReading> readings) {
        Objects.requireNonNull(readings, "readings must not be null");
        if (readings.isEmpty()) {
            return 0;
        }
        List<Row> rows = readings.stream().map(this::toRow).collect(Collectors.toList());
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int start = 0;
                while (start < rows.size()) {
                    // consecutive rows with the same columns share one batch
                    int end = start + 1;
                    while (end < rows.size() && rows.get(end).columns.equals(rows.get(start).columns)) {
                        end++;
                    }
                    try (PreparedStatement ps = conn.prepareStatement(rows.get(start).insertSql(table))) {
                        for (Row row : rows.subList(start, end)) {
                            row.bind(ps);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                    start = end;
                }
                conn.commit();
                return rows.size();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Bulk insert", e);
        }
    }

    private Row toRow(SensorReading reading) {
        SensorReading stripped = reading.without(PipelineConfig.outcomeColumns());
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> field : stripped.getFields().entrySet()) {
            if (field.getKey().equals(timestampColumn)) {
                continue;
            }
            columns.add(requireIdentifier(field.getKey()));
            values.add(field.getValue());
        }
        if (stripped.getObservedAt() != null) {
            columns.add(timestampColumn);
            values.add(Timestamp.from(stripped.getObservedAt()));
        }
        if (columns.isEmpty()) {
            throw new RecordStoreException("Reading has no columns to insert");
        }
        return new Row(columns, values);
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    @Override
    public List<TelemetryRecord> fetchPending(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(fetchPendingSql)) {
            ps.setInt(1, limit);
            List<TelemetryRecord> batch = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Timestamp ts = rs.getTimestamp(2);
                    Instant observedAt = ts != null ? ts.toInstant() : null;
                    batch.add(TelemetryRecord.pending(rs.getLong(1), observedAt, readFeatures(rs, 3)));
                }
            }
            return batch;
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Fetch pending", e);
        }
    }

    @Override
    public int applyOutcomes(List<OutcomeUpdate> updates) {
        Objects.requireNonNull(updates, "updates must not be null");
        if (updates.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(updateOutcomeSql)) {
                for (OutcomeUpdate update : updates) {
                    Outcome outcome = update.getOutcome();
                    ps.setBoolean(1, outcome.isAnomaly());
                    ps.setDouble(2, outcome.getScore());
                    ps.setLong(3, update.getRecordId());
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();

                int applied = 0;
                for (int count : counts) {
                    applied += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
                }
                if (applied < updates.size()) {
                    LOG.warn("{} of {} outcome(s) skipped: record already scored or missing",
                            updates.size() - applied, updates.size());
                }
                return applied;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Apply outcomes", e);
        }
    }

    // ---------------------------------------------------------------
    // Counts and snapshot
    // ---------------------------------------------------------------

    @Override
    public long countAnomalies() {
        return count("SELECT COUNT(*) FROM " + table + " WHERE " + quote(PipelineConfig.ANOMALY_COLUMN) + " = TRUE");
    }

    @Override
    public long countTotal() {
        return count("SELECT COUNT(*) FROM " + table);
    }

    @Override
    public long countPending() {
        return count("SELECT COUNT(*) FROM " + table + " WHERE " + quote(PipelineConfig.ANOMALY_COLUMN) + " IS NULL");
    }

    private long count(String sql) {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Count", e);
        }
    }

    @Override
    public List<double[]> loadFeatureSnapshot() {
        try (Connection conn = dataSource.getConnection()) {
            // a cursor-based fetch needs an open transaction in PostgreSQL
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(snapshotSql)) {
                ps.setFetchSize(10_000);
                List<double[]> snapshot = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        snapshot.add(readFeatures(rs, 1));
                    }
                }
                conn.commit();
                LOG.debug("Loaded feature snapshot: {} row(s)", snapshot.size());
                return snapshot;
            }
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Load snapshot", e);
        }
    }

    @Override
    public void clear() {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("TRUNCATE " + table + " RESTART IDENTITY");
            LOG.info("Cleared all records from {}", table);
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Clear", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double[] readFeatures(ResultSet rs, int firstColumn) throws SQLException {
        double[] features = new double[featureColumns.size()];
        for (int i = 0; i < features.length; i++) {
            Object value = rs.getObject(firstColumn + i);
            features[i] = value instanceof Number n ? n.doubleValue() : Double.NaN;
        }
        return features;
    }

    private static String requireIdentifier(String column) {
        if (!IDENTIFIER.matcher(column).matches()) {
            throw new RecordStoreException("Unsupported column name: '" + column + "'");
        }
        return column;
    }

    private static String quote(String identifier) {
        return '"' + requireIdentifier(identifier) + '"';
    }

    /**
     * Column list and values of one insert.
     */
    private static final class Row {

        private final List<String> columns;
        private final List<Object> values;

        private Row(List<String> columns, List<Object> values) {
            this.columns = columns;
            this.values = values;
        }

        String insertSql(String table) {
            String names = columns.stream().map(JdbcRecordStore::quote).collect(Collectors.joining(", "));
            String params = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
            return "INSERT INTO " + table + " (" + names + ") VALUES (" + params + ")";
        }

        void bind(PreparedStatement ps) throws SQLException {
            for (int i = 0; i < values.size(); i++) {
                Object value = values.get(i);
                if (value instanceof Double d && !Double.isFinite(d)) {
                    value = null;
                }
                ps.setObject(i + 1, value);
            }
        }
    }
}
