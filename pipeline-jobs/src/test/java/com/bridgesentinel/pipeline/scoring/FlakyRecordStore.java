package com.bridgesentinel.pipeline.scoring;

import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.TelemetryRecord;
import com.bridgesentinel.core.store.InMemoryRecordStore;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.core.store.StoreConnectionException;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store that is unreachable for a configurable number of
 * operations, and counts reconnect attempts and applied outcomes.
 */
class FlakyRecordStore implements RecordStore {

    private final InMemoryRecordStore delegate;
    private final AtomicInteger outageRemaining = new AtomicInteger();
    private final AtomicInteger reconnects = new AtomicInteger();
    private final AtomicInteger outcomeWrites = new AtomicInteger();

    FlakyRecordStore(InMemoryRecordStore delegate) {
        this.delegate = delegate;
    }

    /**
     * The next {@code operations} calls to fetchPending fail as lost connections.
     */
    void failNext(int operations) {
        outageRemaining.set(operations);
    }

    int reconnects() {
        return reconnects.get();
    }

    int outcomeWrites() {
        return outcomeWrites.get();
    }

    @Override
    public long insert(SensorReading reading) {
        return delegate.insert(reading);
    }

    @Override
    public int insertAll(List<SensorReading> readings) {
        return delegate.insertAll(readings);
    }

    @Override
    public List<TelemetryRecord> fetchPending(int limit) {
        if (outageRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreConnectionException("connection refused");
        }
        return delegate.fetchPending(limit);
    }

    @Override
    public int applyOutcomes(List<OutcomeUpdate> updates) {
        int applied = delegate.applyOutcomes(updates);
        outcomeWrites.addAndGet(applied);
        return applied;
    }

    @Override
    public long countAnomalies() {
        return delegate.countAnomalies();
    }

    @Override
    public long countTotal() {
        return delegate.countTotal();
    }

    @Override
    public long countPending() {
        return delegate.countPending();
    }

    @Override
    public List<double[]> loadFeatureSnapshot() {
        return delegate.loadFeatureSnapshot();
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    @Override
    public void reconnect() {
        reconnects.incrementAndGet();
        if (outageRemaining.get() > 0) {
            throw new StoreConnectionException("still down");
        }
    }

    @Override
    public void close() {
        delegate.close();
    }
}
