package com.bridgesentinel.pipeline.training;

import com.bridgesentinel.core.scoring.EmptyTrainingSetException;
import com.bridgesentinel.core.scoring.ModelTrainer;
import com.bridgesentinel.core.scoring.TrainingResult;
import com.bridgesentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Loads the full historical snapshot from the store and fits the model once.
 *
 * <p>
 * An empty snapshot raises {@link EmptyTrainingSetException}; there is no
 * retry because the scoring loop cannot start without a model.
 * </p>
 *
 * @since 1.0.0
 */
public class TrainingCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(TrainingCoordinator.class);

    private final RecordStore store;
    private final ModelTrainer trainer;

    public TrainingCoordinator(RecordStore store, ModelTrainer trainer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.trainer = Objects.requireNonNull(trainer, "trainer must not be null");
    }

    /**
     * @return the fitted model and its diagnostics
     * @throws EmptyTrainingSetException if the store holds no records
     * @throws com.bridgesentinel.core.store.RecordStoreException if the
     *         snapshot cannot be read
     */
    public TrainingResult train() {
        LOG.info("Loading training data from record store...");
        List<double[]> snapshot = store.loadFeatureSnapshot();
        if (snapshot.isEmpty()) {
            throw new EmptyTrainingSetException("No data found in the record store. Run SeedJob first.");
        }
        LOG.info("Loaded {} row(s) for training", snapshot.size());
        return trainer.train(snapshot);
    }
}
