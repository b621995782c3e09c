package com.bridgesentinel.pipeline;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.scoring.ModelTrainer;
import com.bridgesentinel.core.scoring.TrainingResult;
import com.bridgesentinel.pipeline.scoring.ScoringLoop;
import com.bridgesentinel.pipeline.store.JdbcRecordStore;
import com.bridgesentinel.pipeline.training.TrainingCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the continuous scoring process.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   connect to the record store
 *     → load the historical snapshot and train the model
 *     → start the health server (health, readiness, status, metrics)
 *     → score pending records until SIGINT/SIGTERM
 * </pre>
 *
 * <p>
 * Options: {@code --batch-size}, {@code --interval-ms}. See
 * {@link JobSettings} for the environment variables.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringJob {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringJob.class);

    private ScoringJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobSupport.exit(JobSupport.run("Scoring", args, ScoringJob::run));
    }

    static void run(JobSettings settings, PipelineConfig config, ShutdownSignal signal) {
        try (JdbcRecordStore store = new JdbcRecordStore(settings, config)) {
            TrainingResult training = new TrainingCoordinator(store, new ModelTrainer(config.getModel())).train();

            PipelineMetrics metrics = new PipelineMetrics();
            ScoringLoop loop = ScoringLoop.builder(store, training.getModel())
                    .batchSize(settings.getBatchSize())
                    .interval(settings.getInterval())
                    .statusEveryIdleCycles(settings.getStatusEveryIdleCycles())
                    .metrics(metrics)
                    .build();

            HealthServer healthServer = new HealthServer(loop::status, metrics);
            if (settings.getHealthPort() > 0) {
                healthServer.start(settings.getHealthPort());
            }
            try {
                loop.run(signal);
            } finally {
                healthServer.stop();
                LOG.info("Scoring metrics: {}", metrics.snapshot());
            }
        }
    }
}
