package com.bridgesentinel.pipeline;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.SplitBoundary;
import com.bridgesentinel.pipeline.replay.CsvDatasetReader;
import com.bridgesentinel.pipeline.replay.FeedProducer;
import com.bridgesentinel.pipeline.store.JdbcRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the synthetic live feed.
 *
 * <p>
 * Options: {@code --count} (0 = all remaining rows), {@code --speed}
 * (seconds between inserts), {@code --dataset}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReplayJob {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayJob.class);

    private ReplayJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobSupport.exit(JobSupport.run("Replay", args, ReplayJob::run));
    }

    static void run(JobSettings settings, PipelineConfig config, ShutdownSignal signal) {
        List<SensorReading> source = new CsvDatasetReader(config.getTimestampColumn())
                .read(Path.of(settings.getDatasetPath()));

        try (JdbcRecordStore store = new JdbcRecordStore(settings, config)) {
            PipelineMetrics metrics = new PipelineMetrics();
            FeedProducer producer = new FeedProducer(store, source, new SplitBoundary(settings.getTrainRatio()),
                    Clock.systemDefaultZone(), metrics);
            producer.replay(settings.getReplayCount(), settings.getReplayInterval(), signal);
            LOG.info("Replay metrics: {}", metrics.snapshot());
        }
    }
}
