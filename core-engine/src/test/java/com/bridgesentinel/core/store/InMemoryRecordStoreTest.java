package com.bridgesentinel.core.store;

import com.bridgesentinel.core.model.Outcome;
import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.TelemetryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryRecordStore}.
 */
class InMemoryRecordStoreTest {

    private static final List<String> FEATURES = List.of("strain_microstrain", "vibration_ms2");

    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore(FEATURES);
    }

    private static SensorReading reading(double strain) {
        SensorReading reading = new SensorReading();
        reading.setObservedAt(Instant.parse("2024-03-01T12:00:00Z"));
        reading.setField("strain_microstrain", strain);
        reading.setField("vibration_ms2", 0.3);
        reading.setField("structural_health_index_shi", 0.92);
        return reading;
    }

    private void insertMany(int count) {
        List<SensorReading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            readings.add(reading(i));
        }
        store.insertAll(readings);
    }

    @Test
    @DisplayName("Ids should start at 1 and increase per insertion")
    void idsIncrease() {
        assertThat(store.insert(reading(1))).isEqualTo(1L);
        assertThat(store.insert(reading(2))).isEqualTo(2L);
        assertThat(store.countTotal()).isEqualTo(2);
    }

    @Test
    @DisplayName("Inserted records should be pending even if the reading carried an outcome")
    void insertIgnoresOutcomeColumns() {
        SensorReading labelled = reading(5);
        labelled.setField("is_anomaly", true);
        labelled.setField("anomaly_score", -0.4);

        long id = store.insert(labelled);

        assertThat(store.get(id).isPending()).isTrue();
        assertThat(store.countPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("fetchPending should cap the batch and order by id")
    void fetchPendingCapsBatch() {
        insertMany(500);

        List<TelemetryRecord> batch = store.fetchPending(100);

        assertThat(batch).hasSize(100);
        assertThat(batch).extracting(TelemetryRecord::getId)
                .isSorted()
                .startsWith(1L)
                .endsWith(100L);
        assertThat(store.countPending()).isEqualTo(500);
    }

    @Test
    @DisplayName("Every pending record should eventually be fetched exactly once")
    void pendingCompleteness() {
        insertMany(250);
        List<Long> seen = new ArrayList<>();

        List<TelemetryRecord> batch;
        while (!(batch = store.fetchPending(100)).isEmpty()) {
            List<OutcomeUpdate> updates = new ArrayList<>();
            for (TelemetryRecord record : batch) {
                seen.add(record.getId());
                updates.add(new OutcomeUpdate(record.getId(), new Outcome(false, 0.1)));
            }
            store.applyOutcomes(updates);
        }

        assertThat(seen).hasSize(250).doesNotHaveDuplicates();
        assertThat(store.countPending()).isZero();
    }

    @Test
    @DisplayName("An existing outcome should never be overwritten")
    void outcomeIsWrittenOnce() {
        long id = store.insert(reading(1));
        Outcome first = new Outcome(true, -0.2);

        assertThat(store.applyOutcomes(List.of(new OutcomeUpdate(id, first)))).isEqualTo(1);
        assertThat(store.applyOutcomes(List.of(new OutcomeUpdate(id, new Outcome(false, 0.3))))).isZero();

        assertThat(store.get(id).getOutcome()).contains(first);
        assertThat(store.countAnomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("A batch with an unknown id should change nothing")
    void applyOutcomesIsAllOrNothing() {
        long id = store.insert(reading(1));

        assertThatThrownBy(() -> store.applyOutcomes(List.of(
                new OutcomeUpdate(id, new Outcome(true, -0.1)),
                new OutcomeUpdate(999L, new Outcome(true, -0.1)))))
                .isInstanceOf(RecordStoreException.class)
                .hasMessageContaining("999");

        assertThat(store.get(id).isPending()).isTrue();
    }

    @Test
    @DisplayName("Feature snapshot should follow id order with NaN for absent values")
    void featureSnapshot() {
        store.insert(reading(10));
        SensorReading partial = new SensorReading();
        partial.setField("strain_microstrain", 20.0);
        store.insert(partial);

        List<double[]> snapshot = store.loadFeatureSnapshot();

        assertThat(snapshot).hasSize(2);
        assertThat(snapshot.get(0)).containsExactly(10.0, 0.3);
        assertThat(snapshot.get(1)[0]).isEqualTo(20.0);
        assertThat(snapshot.get(1)[1]).isNaN();
    }

    @Test
    @DisplayName("clear() should restart id assignment")
    void clearRestartsIds() {
        insertMany(3);

        store.clear();

        assertThat(store.countTotal()).isZero();
        assertThat(store.insert(reading(1))).isEqualTo(1L);
    }

    @Test
    @DisplayName("A closed store should report connection failures until reconnected")
    void closedStoreFailsUntilReconnect() {
        store.insert(reading(1));
        store.close();

        assertThatThrownBy(() -> store.fetchPending(10)).isInstanceOf(StoreConnectionException.class);

        store.reconnect();
        assertThat(store.fetchPending(10)).hasSize(1);
    }
}
