package com.bridgesentinel.core.store;

import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.TelemetryRecord;

import java.util.List;

/**
 * Durable table of telemetry records keyed by a strictly increasing id.
 *
 * <p>
 * A record is <em>pending</em> while it has no outcome. Outcomes are written
 * at most once: implementations never overwrite an outcome that is already
 * present.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Every operation reports failure with an unchecked
 * {@link RecordStoreException}. Failures caused by lost connectivity are
 * reported as {@link StoreConnectionException}, the only kind that
 * {@link #reconnect()} can fix.
 * </p>
 *
 * @since 1.0.0
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Insert one reading as a new pending record. Outcome columns present on
     * the reading are ignored.
     *
     * @return the id assigned by the store
     */
    long insert(SensorReading reading);

    /**
     * Insert readings in one transaction, in list order.
     *
     * @return number of records inserted
     */
    int insertAll(List<SensorReading> readings);

    /**
     * Fetch up to {@code limit} pending records in ascending id order.
     *
     * @param limit maximum batch size; must be {@code >= 1}
     */
    List<TelemetryRecord> fetchPending(int limit);

    /**
     * Persist outcomes as one all-or-nothing unit.
     *
     * <p>
     * Records that already carry an outcome are left untouched and do not
     * count as applied.
     * </p>
     *
     * @return number of records whose outcome was written
     */
    int applyOutcomes(List<OutcomeUpdate> updates);

    long countAnomalies();

    long countTotal();

    long countPending();

    /**
     * @return every stored record's feature vector ordered by id; absent
     *         values are NaN
     */
    List<double[]> loadFeatureSnapshot();

    /**
     * Remove every record and restart id assignment.
     */
    void clear();

    /**
     * Drop the current connection and open a fresh one.
     *
     * @throws StoreConnectionException if the store is still unreachable
     */
    void reconnect();

    @Override
    void close();
}
