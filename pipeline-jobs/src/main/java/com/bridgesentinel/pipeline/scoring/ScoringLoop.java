package com.bridgesentinel.pipeline.scoring;

import com.bridgesentinel.core.model.Outcome;
import com.bridgesentinel.core.model.OutcomeUpdate;
import com.bridgesentinel.core.model.TelemetryRecord;
import com.bridgesentinel.core.scoring.ScoringModel;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.core.store.RecordStoreException;
import com.bridgesentinel.core.store.StoreConnectionException;
import com.bridgesentinel.pipeline.PipelineMetrics;
import com.bridgesentinel.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded-batch polling loop that scores pending records exactly once.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>Fetch up to {@code batchSize} pending records by ascending id</li>
 * <li>Nothing pending: idle, with a "waiting" status line every
 * {@code statusEveryIdleCycles} cycles</li>
 * <li>Otherwise score the batch, persist every outcome in one all-or-nothing
 * store call, then refresh the anomaly total from the store</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * <p>
 * A {@link StoreConnectionException} moves the loop to
 * {@link LoopState#RECONNECTING} and triggers one immediate reconnect
 * attempt; a successful reconnect returns it to {@link LoopState#CONNECTED}
 * straight away. Any other failure is logged and the cycle abandoned; its batch
 * stays pending for the next cycle. Nothing escapes a cycle.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * {@link #run(ShutdownSignal)} runs on a single thread. Shutdown is only
 * observed at the top of a cycle, so a batch in flight always completes.
 * {@link #status()} may be called from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoringLoop {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringLoop.class);

    private final RecordStore store;
    private final ScoringModel model;
    private final int batchSize;
    private final Duration interval;
    private final int statusEveryIdleCycles;
    private final PipelineMetrics metrics;
    private final Clock clock;

    // loop-thread state
    private LoopState state = LoopState.CONNECTED;
    private long cycle;
    private long totalScored;
    private long totalAnomalies;
    private long reconnectAttempts;
    private Instant lastBatchAt;

    private volatile LoopStatus status;

    private ScoringLoop(Builder b) {
        this.store = b.store;
        this.model = b.model;
        this.batchSize = b.batchSize;
        this.interval = b.interval;
        this.statusEveryIdleCycles = b.statusEveryIdleCycles;
        this.metrics = b.metrics;
        this.clock = b.clock;
        publish();
    }

    public static Builder builder(RecordStore store, ScoringModel model) {
        return new Builder(store, model);
    }

    // ---------------------------------------------------------------
    // Loop
    // ---------------------------------------------------------------

    /**
     * Run cycles until shutdown is requested, then close the store.
     */
    public void run(ShutdownSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        LOG.info("Starting scoring loop (every {} ms, batch={})", interval.toMillis(), batchSize);

        while (!signal.isShutdownRequested()) {
            runCycle();
            signal.sleep(interval);
        }

        state = LoopState.STOPPING;
        publish();
        try {
            store.close();
        } catch (RecordStoreException e) {
            LOG.warn("Error while closing record store: {}", e.getMessage());
        }
        state = LoopState.STOPPED;
        publish();
        LOG.info("Scoring loop stopped. Total scored: {} | Anomalies found: {} | Reconnect attempts: {}",
                totalScored, totalAnomalies, reconnectAttempts);
    }

    /**
     * Execute one cycle. Never throws for store or scoring failures.
     */
    public CycleResult runCycle() {
        cycle++;
        try {
            return state == LoopState.RECONNECTING ? recover(doCycle()) : doCycle();
        } catch (StoreConnectionException e) {
            metrics.incrementCycleFailures();
            state = LoopState.RECONNECTING;
            LOG.warn("Cycle {}: store connection lost: {}", cycle, e.getMessage());
            attemptReconnect();
            return CycleResult.connectionLost(cycle);
        } catch (RuntimeException e) {
            metrics.incrementCycleFailures();
            LOG.error("Cycle {}: scoring error, batch left pending: {}", cycle, e.getMessage(), e);
            return CycleResult.failed(cycle);
        } finally {
            publish();
        }
    }

    private CycleResult recover(CycleResult result) {
        state = LoopState.CONNECTED;
        LOG.info("Cycle {}: store connection restored", cycle);
        return result;
    }

    private CycleResult doCycle() {
        List<TelemetryRecord> batch = store.fetchPending(batchSize);
        if (batch.isEmpty()) {
            if (cycle % statusEveryIdleCycles == 0) {
                LOG.info("Waiting for new data... ({} scored so far)", totalScored);
            }
            return CycleResult.idle(cycle);
        }

        long started = System.nanoTime();
        List<double[]> rows = new ArrayList<>(batch.size());
        for (TelemetryRecord record : batch) {
            rows.add(record.getFeatures());
        }
        List<Outcome> outcomes = model.scoreBatch(rows);

        List<OutcomeUpdate> updates = new ArrayList<>(batch.size());
        int anomalies = 0;
        for (int i = 0; i < batch.size(); i++) {
            Outcome outcome = outcomes.get(i);
            updates.add(new OutcomeUpdate(batch.get(i).getId(), outcome));
            if (outcome.isAnomaly()) {
                anomalies++;
            }
        }

        long anomaliesBefore = store.countAnomalies();
        int applied = store.applyOutcomes(updates);
        totalScored += applied;
        lastBatchAt = clock.instant();
        totalAnomalies = store.countAnomalies();
        // outcomes skipped by the store must not count as flagged
        int flagged = (int) Math.max(0, Math.min(anomalies, totalAnomalies - anomaliesBefore));
        metrics.recordBatch(applied, flagged, Duration.ofNanos(System.nanoTime() - started));

        if (applied < batch.size()) {
            LOG.warn("Cycle {}: {} of {} outcome(s) were not applied", cycle, batch.size() - applied, batch.size());
        }
        LOG.info("Cycle {}: scored {} of {} ({} anomalous) | total anomalies {} | total scored {} | {}",
                cycle, applied, batch.size(), flagged, totalAnomalies, totalScored, lastBatchAt);
        LOG.debug("Cycle {}: id range [{}, {}]", cycle, batch.get(0).getId(), batch.get(batch.size() - 1).getId());
        return CycleResult.scored(cycle, applied, flagged);
    }

    private void attemptReconnect() {
        reconnectAttempts++;
        metrics.incrementReconnectAttempts();
        try {
            store.reconnect();
            state = LoopState.CONNECTED;
            LOG.info("Reconnected to record store");
        } catch (RecordStoreException e) {
            LOG.warn("Reconnection failed, retrying next cycle: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while reconnecting, retrying next cycle: {}", e.getMessage(), e);
        }
    }

    private void publish() {
        status = new LoopStatus(state, cycle, totalScored, totalAnomalies, reconnectAttempts, lastBatchAt);
    }

    // ---------------------------------------------------------------
    // Observers
    // ---------------------------------------------------------------

    /**
     * @return the latest published snapshot; safe from any thread
     */
    public LoopStatus status() {
        return status;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ScoringLoop}.
     */
    public static class Builder {
        private final RecordStore store;
        private final ScoringModel model;
        private int batchSize = 100;
        private Duration interval = Duration.ofSeconds(2);
        private int statusEveryIdleCycles = 10;
        private PipelineMetrics metrics;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(RecordStore store, ScoringModel model) {
            this.store = Objects.requireNonNull(store, "store must not be null");
            this.model = Objects.requireNonNull(model, "model must not be null");
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder interval(Duration v) {
            this.interval = v;
            return this;
        }

        public Builder statusEveryIdleCycles(int v) {
            this.statusEveryIdleCycles = v;
            return this;
        }

        public Builder metrics(PipelineMetrics v) {
            this.metrics = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public ScoringLoop build() {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
            }
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("interval must be >= 0, got: " + interval);
            }
            if (statusEveryIdleCycles < 1) {
                throw new IllegalArgumentException(
                        "statusEveryIdleCycles must be >= 1, got: " + statusEveryIdleCycles);
            }
            Objects.requireNonNull(clock, "clock must not be null");
            if (metrics == null) {
                metrics = new PipelineMetrics();
            }
            return new ScoringLoop(this);
        }
    }
}
