package com.bridgesentinel.pipeline.replay;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.SplitBoundary;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.core.store.RecordStoreException;
import com.bridgesentinel.pipeline.PipelineMetrics;
import com.bridgesentinel.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Replays the held-back suffix of the historical dataset as a live feed.
 *
 * <p>
 * Only rows {@code [floor(N * r), N)} are exposed, where {@code r} is the
 * same split ratio the seeder uses. Each replayed row is stripped of outcome
 * columns, stamped with the current time and inserted as a new pending
 * record.
 * </p>
 *
 * <h3>Termination</h3>
 * <p>
 * A run stops after {@code min(maxCount, available)} insertion attempts, at
 * the end of the suffix, or when shutdown is requested between insertions.
 * A failed insertion is logged and skipped, never retried.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedProducer {

    private static final Logger LOG = LoggerFactory.getLogger(FeedProducer.class);

    private final RecordStore store;
    private final List<SensorReading> replayRows;
    private final int trainingRows;
    private final Clock clock;
    private final PipelineMetrics metrics;

    public FeedProducer(RecordStore store, List<SensorReading> source, SplitBoundary split,
            Clock clock, PipelineMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(split, "split must not be null");
        this.replayRows = split.replaySuffix(source);
        this.trainingRows = split.boundaryIndex(source.size());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        LOG.info("Source rows: {} | training rows (already seeded): {} | rows to replay: {}",
                source.size(), trainingRows, replayRows.size());
    }

    /**
     * @return number of rows available for replay
     */
    public int available() {
        return replayRows.size();
    }

    /**
     * Replay rows in order.
     *
     * @param maxCount maximum rows to send; 0 means all remaining
     * @param interval pause between insertions; none after the last row
     * @param signal   cooperative shutdown, checked between insertions
     * @return counts for the run
     * @throws IllegalArgumentException if {@code maxCount} or
     *                                  {@code interval} is negative
     */
    public ReplayReport replay(int maxCount, Duration interval, ShutdownSignal signal) {
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount must be >= 0, got: " + maxCount);
        }
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0, got: " + interval);
        }
        Objects.requireNonNull(signal, "signal must not be null");

        int planned = maxCount > 0 ? Math.min(maxCount, replayRows.size()) : replayRows.size();
        LOG.info("Replaying {} row(s) at {} ms intervals", planned, interval.toMillis());

        int attempted = 0;
        int succeeded = 0;
        for (int i = 0; i < planned; i++) {
            if (signal.isShutdownRequested()) {
                break;
            }
            attempted++;
            SensorReading row = prepare(replayRows.get(i));
            try {
                long id = store.insert(row);
                succeeded++;
                metrics.incrementReplayInserted();
                logProgress(succeeded, planned, id, row);
            } catch (RecordStoreException e) {
                metrics.incrementReplayFailed();
                LOG.warn("Insert error at replay row {}: {}", i, e.getMessage());
            }
            if (i < planned - 1) {
                signal.sleep(interval);
            }
        }

        ReplayReport report = new ReplayReport(planned, attempted, succeeded);
        LOG.info("Replay complete. Rows inserted: {} / {} (attempted {})", succeeded, planned, attempted);
        return report;
    }

    private SensorReading prepare(SensorReading source) {
        SensorReading row = source.without(PipelineConfig.outcomeColumns());
        row.setObservedAt(clock.instant());
        return row;
    }

    private static void logProgress(int count, int planned, long id, SensorReading row) {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        Instant at = row.getObservedAt();
        double strain = row.getNumericField("strain_microstrain").orElse(0.0);
        double vibration = row.getNumericField("vibration_ms2").orElse(0.0);
        String shi = row.getNumericField("structural_health_index_shi")
                .map(v -> String.format("%.4f", v))
                .orElse("-");
        LOG.info("{} id={} {} strain={} vib={} shi={} {}%", count, id, at,
                String.format("%.2f", strain), String.format("%.4f", vibration), shi,
                String.format("%.1f", count * 100.0 / planned));
    }
}
