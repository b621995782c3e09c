package com.bridgesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfigLoader}.
 */
class PipelineConfigLoaderTest {

    @Test
    @DisplayName("Should load test pipeline from classpath")
    void shouldLoadFromClasspath() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");

        assertThat(config.getTable()).isEqualTo("bridge_test");
        assertThat(config.getTimestampColumn()).isEqualTo("timestamp");
        assertThat(config.getFeatureColumns())
                .containsExactly("strain_microstrain", "vibration_ms2", "tilt_deg");
        assertThat(config.getModel().getType()).isEqualTo(ModelSettings.TYPE_Z_SCORE);
        assertThat(config.getModel().getContamination()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should keep model defaults for omitted keys")
    void shouldApplyModelDefaults() {
        ModelSettings model = PipelineConfigLoader.fromClasspath("test-pipeline.yml").getModel();

        assertThat(model.getTrees()).isEqualTo(200);
        assertThat(model.getSampleSize()).isEqualTo(256);
        assertThat(model.getSeed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("invalid-pipeline.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'table' must be a lowercase SQL identifier")
                .hasMessageContaining("Duplicate feature column: 'strain_microstrain'")
                .hasMessageContaining("'is_anomaly' clashes with a reserved column")
                .hasMessageContaining("contamination")
                .hasMessageContaining("'trees' >= 1");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pipeline.yml");
        Files.writeString(file, "featureColumns: [deflection_mm]\n");

        PipelineConfig config = PipelineConfigLoader.fromFile(file.toString());

        assertThat(config.getTable()).isEqualTo("bridge_dataset");
        assertThat(config.getFeatureColumns()).containsExactly("deflection_mm");
        assertThat(config.getModel().getType()).isEqualTo(ModelSettings.TYPE_ISOLATION_FOREST);
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "featureColumns: [deflection_mm\nmodel: {\n");

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should reject an empty file")
    void shouldRejectEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("nope.yml").toString();

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
