package com.bridgesentinel.core.store;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.model.Outcome;
import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link RecordStore} held in process memory.
 *
 * <p>
 * Used for embedded runs and tests. Ids start at 1 and increase by one per
 * insertion. All operations are {@code synchronized} on the store instance.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final List<String> featureColumns;
    private final NavigableMap<Long, TelemetryRecord> records = new TreeMap<>();
    private long nextId = 1;
    private boolean closed;

    /**
     * @param featureColumns ordered feature columns extracted from inserted
     *                       readings
     */
    public InMemoryRecordStore(List<String> featureColumns) {
        Objects.requireNonNull(featureColumns, "featureColumns must not be null");
        if (featureColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one feature column is required");
        }
        this.featureColumns = List.copyOf(featureColumns);
    }

    @Override
    public synchronized long insert(SensorReading reading) {
        ensureOpen();
        Objects.requireNonNull(reading, "reading must not be null");
        return store(reading);
    }

    @Override
    public synchronized int insertAll(List<SensorReading> readings) {
        ensureOpen();
        Objects.requireNonNull(readings, "readings must not be null");
        readings.forEach(r -> Objects.requireNonNull(r, "reading must not be null"));
        readings.forEach(this::store);
        return readings.size();
    }

    private long store(SensorReading reading) {
        SensorReading row = reading.without(PipelineConfig.outcomeColumns());
        long id = nextId++;
        records.put(id, TelemetryRecord.pending(id, row.getObservedAt(), row.featureVector(featureColumns)));
        return id;
    }

    @Override
    public synchronized List<TelemetryRecord> fetchPending(int limit) {
        ensureOpen();
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        List<TelemetryRecord> batch = new ArrayList<>(Math.min(limit, records.size()));
        for (TelemetryRecord record : records.values()) {
            if (batch.size() == limit) {
                break;
            }
            if (record.isPending()) {
                batch.add(record);
            }
        }
        return batch;
    }

    @Override
    public synchronized int applyOutcomes(List<OutcomeUpdate> updates) {
        ensureOpen();
        Objects.requireNonNull(updates, "updates must not be null");

        // validate the whole batch before touching anything
        for (OutcomeUpdate update : updates) {
            if (!records.containsKey(update.getRecordId())) {
                throw new RecordStoreException("No record with id " + update.getRecordId());
            }
        }

        int applied = 0;
        for (OutcomeUpdate update : updates) {
            TelemetryRecord current = records.get(update.getRecordId());
            if (!current.isPending()) {
                LOG.warn("Record {} already scored, keeping existing outcome", current.getId());
                continue;
            }
            records.put(current.getId(), current.withOutcome(update.getOutcome()));
            applied++;
        }
        return applied;
    }

    @Override
    public synchronized long countAnomalies() {
        ensureOpen();
        return records.values().stream()
                .filter(r -> r.getOutcome().map(Outcome::isAnomaly).orElse(false))
                .count();
    }

    @Override
    public synchronized long countTotal() {
        ensureOpen();
        return records.size();
    }

    @Override
    public synchronized long countPending() {
        ensureOpen();
        return records.values().stream().filter(TelemetryRecord::isPending).count();
    }

    @Override
    public synchronized List<double[]> loadFeatureSnapshot() {
        ensureOpen();
        List<double[]> snapshot = new ArrayList<>(records.size());
        for (Map.Entry<Long, TelemetryRecord> entry : records.entrySet()) {
            snapshot.add(entry.getValue().getFeatures());
        }
        return snapshot;
    }

    @Override
    public synchronized void clear() {
        ensureOpen();
        records.clear();
        nextId = 1;
    }

    /**
     * Reopens a closed store; records survive.
     */
    @Override
    public synchronized void reconnect() {
        closed = false;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    /**
     * @return the stored record, including its outcome if scored
     */
    public synchronized TelemetryRecord get(long id) {
        TelemetryRecord record = records.get(id);
        if (record == null) {
            throw new RecordStoreException("No record with id " + id);
        }
        return record;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreConnectionException("Store is closed");
        }
    }
}
