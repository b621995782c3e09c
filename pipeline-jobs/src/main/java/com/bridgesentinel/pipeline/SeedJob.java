package com.bridgesentinel.pipeline;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.model.SplitBoundary;
import com.bridgesentinel.pipeline.replay.CsvDatasetReader;
import com.bridgesentinel.pipeline.replay.HistoricalSeeder;
import com.bridgesentinel.pipeline.replay.SeedReport;
import com.bridgesentinel.pipeline.store.JdbcRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the training prefix of the dataset into the record store.
 *
 * <p>
 * Option {@code --truncate} clears the table first; without it a non-empty
 * table is left untouched.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeedJob {

    private static final Logger LOG = LoggerFactory.getLogger(SeedJob.class);

    private SeedJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobSupport.exit(JobSupport.run("Seed", args, SeedJob::run));
    }

    static void run(JobSettings settings, PipelineConfig config, ShutdownSignal signal) {
        List<SensorReading> source = new CsvDatasetReader(config.getTimestampColumn())
                .read(Path.of(settings.getDatasetPath()));

        try (JdbcRecordStore store = new JdbcRecordStore(settings, config)) {
            SeedReport report = new HistoricalSeeder(store, settings.getSeedChunkSize())
                    .seed(source, new SplitBoundary(settings.getTrainRatio()), settings.isTruncate(), signal);
            if (!report.isSkipped()) {
                LOG.info("Training data: {} row(s) | real-time data: {} row(s) reserved for ReplayJob",
                        report.getTrainingRows(), report.getReplayRows());
                LOG.info("Next: run ScoringJob to score the training data, then ReplayJob");
            }
        }
    }
}
