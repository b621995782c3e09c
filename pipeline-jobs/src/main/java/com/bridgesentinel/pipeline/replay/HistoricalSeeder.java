package com.bridgesentinel.pipeline.replay;

import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.SplitBoundary;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.pipeline.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Loads the training prefix of the historical dataset into the store.
 *
 * <p>
 * A store that already holds records is left alone unless clearing was
 * requested, in which case it is truncated and id assignment restarts.
 * Rows are inserted in chunks, each chunk in one transaction, keeping their
 * historical timestamps.
 * </p>
 *
 * @since 1.0.0
 */
public class HistoricalSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(HistoricalSeeder.class);

    private final RecordStore store;
    private final int chunkSize;

    public HistoricalSeeder(RecordStore store, int chunkSize) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * @param source   every dataset row in source order
     * @param split    training/replay boundary shared with the feed producer
     * @param truncate clear existing records first
     * @param signal   cooperative shutdown, checked between chunks
     */
    public SeedReport seed(List<SensorReading> source, SplitBoundary split, boolean truncate,
            ShutdownSignal signal) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(split, "split must not be null");
        Objects.requireNonNull(signal, "signal must not be null");

        List<SensorReading> training = split.trainingPrefix(source);
        int replay = source.size() - training.size();
        LOG.info("Split: {} training row(s) | {} real-time row(s) (ratio {})",
                training.size(), replay, split.getRatio());

        long existing = store.countTotal();
        if (existing > 0) {
            if (!truncate) {
                LOG.warn("Store already has {} record(s). Rerun with --truncate to clear and re-seed.", existing);
                return SeedReport.skipped(training.size(), replay, existing);
            }
            store.clear();
            LOG.info("Cleared {} existing record(s)", existing);
        }

        long started = System.nanoTime();
        int inserted = 0;
        for (int from = 0; from < training.size(); from += chunkSize) {
            if (signal.isShutdownRequested()) {
                LOG.warn("Seeding interrupted after {} row(s)", inserted);
                break;
            }
            int to = Math.min(from + chunkSize, training.size());
            inserted += store.insertAll(training.subList(from, to));
            LOG.info("[{} / {}] {}%", inserted, training.size(),
                    String.format("%5.1f", training.isEmpty() ? 100.0 : inserted * 100.0 / training.size()));
        }
        double elapsed = (System.nanoTime() - started) / 1e9;

        long stored = store.countTotal();
        long pending = store.countPending();
        LOG.info("Seeded {} training row(s) in {}s. Verified: {} record(s) stored, {} awaiting scoring",
                inserted, String.format("%.1f", elapsed), stored, pending);
        return SeedReport.completed(training.size(), replay, inserted, stored, pending);
    }
}
