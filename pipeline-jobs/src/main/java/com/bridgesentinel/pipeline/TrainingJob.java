package com.bridgesentinel.pipeline;

import com.bridgesentinel.core.config.PipelineConfig;
import com.bridgesentinel.core.scoring.ModelTrainer;
import com.bridgesentinel.core.scoring.TrainingDiagnostics;
import com.bridgesentinel.pipeline.store.JdbcRecordStore;
import com.bridgesentinel.pipeline.training.TrainingCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains the model on the stored history, reports diagnostics and exits.
 * Nothing is written to the store.
 *
 * @since 1.0.0
 */
public final class TrainingJob {

    private static final Logger LOG = LoggerFactory.getLogger(TrainingJob.class);

    private TrainingJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobSupport.exit(JobSupport.run("Training", args, TrainingJob::run));
    }

    static void run(JobSettings settings, PipelineConfig config, ShutdownSignal signal) {
        try (JdbcRecordStore store = new JdbcRecordStore(settings, config)) {
            TrainingDiagnostics diagnostics = new TrainingCoordinator(store, new ModelTrainer(config.getModel()))
                    .train()
                    .getDiagnostics();
            LOG.info("Dry run complete: {}", diagnostics);
        }
    }
}
