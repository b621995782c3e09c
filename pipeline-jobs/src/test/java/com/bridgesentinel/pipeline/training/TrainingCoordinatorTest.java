package com.bridgesentinel.pipeline.training;

import com.bridgesentinel.core.config.ModelSettings;
import com.bridgesentinel.core.model.SensorReading;
import com.bridgesentinel.core.scoring.EmptyTrainingSetException;
import com.bridgesentinel.core.scoring.ModelTrainer;
import com.bridgesentinel.core.scoring.TrainingResult;
import com.bridgesentinel.core.store.InMemoryRecordStore;
import com.bridgesentinel.core.store.RecordStore;
import com.bridgesentinel.core.store.StoreConnectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TrainingCoordinator}.
 */
class TrainingCoordinatorTest {

    private static final List<String> FEATURES = List.of("strain_microstrain", "vibration_ms2");

    private static ModelTrainer trainer() {
        ModelSettings settings = new ModelSettings();
        settings.setTrees(50);
        settings.setContamination(0.05);
        settings.setSeed(42);
        return new ModelTrainer(settings);
    }

    @Test
    @DisplayName("Should fit on every stored record")
    void trainsOnSnapshot() {
        InMemoryRecordStore store = new InMemoryRecordStore(FEATURES);
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            SensorReading reading = new SensorReading();
            reading.setField("strain_microstrain", 120 + random.nextGaussian() * 5);
            reading.setField("vibration_ms2", 0.3 + random.nextGaussian() * 0.05);
            store.insert(reading);
        }

        TrainingResult result = new TrainingCoordinator(store, trainer()).train();

        assertThat(result.getDiagnostics().getRows()).isEqualTo(200);
        assertThat(result.getModel().featureCount()).isEqualTo(2);
        assertThat(store.countPending()).isEqualTo(200);
    }

    @Test
    @DisplayName("An empty store should fail training")
    void emptyStore() {
        TrainingCoordinator coordinator = new TrainingCoordinator(new InMemoryRecordStore(FEATURES), trainer());

        assertThatThrownBy(coordinator::train)
                .isInstanceOf(EmptyTrainingSetException.class)
                .hasMessageContaining("No data");
    }

    @Test
    @DisplayName("Store failures should propagate")
    void storeFailurePropagates() {
        RecordStore store = mock(RecordStore.class);
        when(store.loadFeatureSnapshot()).thenThrow(new StoreConnectionException("connection refused"));

        assertThatThrownBy(() -> new TrainingCoordinator(store, trainer()).train())
                .isInstanceOf(StoreConnectionException.class);
    }
}
