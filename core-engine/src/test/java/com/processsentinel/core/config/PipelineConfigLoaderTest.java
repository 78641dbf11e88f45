package com.processsentinel.core.config;

import com.processsentinel.core.detection.TrainingSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfigLoader} and {@link PipelineConfig}.
 */
class PipelineConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");

        assertThat(config.getWindowLength()).isEqualTo(10);
        assertThat(config.getStride()).isEqualTo(5);
        assertThat(config.getThreshold()).isEqualTo(0.4);
        assertThat(config.featureSchema().getColumns())
                .containsExactly("Mixer/Level", "Mixer/Temperature", "Pasteurizer/Temperature");
        // untouched keys keep their defaults
        assertThat(config.getGradientClipNorm()).isEqualTo(5.0);
        assertThat(config.getRunIdColumn()).isEqualTo("Run id");
    }

    @Test
    @DisplayName("Stage settings should carry the shared and per-stage values")
    void shouldDeriveStageSettings() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");

        TrainingSettings detector = config.detectorSettings();
        TrainingSettings classifier = config.classifierSettings();
        assertThat(detector.getHiddenSize()).isEqualTo(6);
        assertThat(classifier.getHiddenSize()).isEqualTo(8);
        assertThat(detector.getEpochs()).isEqualTo(3);
        assertThat(classifier.getLearningRate()).isEqualTo(0.01);
        assertThat(detector.getThreshold()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Empty document should yield the defaults")
    void emptyDocumentYieldsDefaults() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("empty-pipeline.yml");

        assertThat(config.getWindowLength()).isEqualTo(60);
        assertThat(config.getStride()).isEqualTo(10);
        assertThat(config.getEpochs()).isEqualTo(12);
        assertThat(config.getBatchSize()).isEqualTo(256);
        assertThat(config.featureSchema().size()).isEqualTo(54);
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("invalid-pipeline.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowLength")
                .hasMessageContaining("stride")
                .hasMessageContaining("testFraction");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and reject duplicate keys")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("pipeline.yml");
        Files.writeString(good, "windowLength: 30\nstratifiedSplit: true\n");
        PipelineConfig config = PipelineConfigLoader.fromFile(good.toString());
        assertThat(config.getWindowLength()).isEqualTo(30);
        assertThat(config.isStratifiedSplit()).isTrue();

        Path duplicate = dir.resolve("duplicate.yml");
        Files.writeString(duplicate, "stride: 5\nstride: 6\n");
        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(duplicate.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
