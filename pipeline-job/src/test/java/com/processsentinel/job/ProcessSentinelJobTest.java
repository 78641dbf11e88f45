package com.processsentinel.job;

import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.pipeline.PipelineResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the train and serve modes of {@link ProcessSentinelJob}.
 */
class ProcessSentinelJobTest {

    private static final String PIPELINE_YAML = String.join("\n",
            "windowLength: 8",
            "stride: 4",
            "testFraction: 0.25",
            "splitSeed: 3",
            "epochs: 2",
            "batchSize: 16",
            "learningRate: 0.01",
            "detectorHiddenSize: 4",
            "classifierHiddenSize: 4",
            "featureColumns:",
            "  - \"Mixer/Level\"",
            "  - \"Mixer/Temperature\"",
            "");

    @Test
    @DisplayName("Train should write an artifact that serve can load")
    void trainThenServe(@TempDir Path dir) throws IOException {
        Path csv = writeRuns(dir.resolve("runs.csv"), 8, 24);
        Path yaml = Files.writeString(dir.resolve("pipeline.yml"), PIPELINE_YAML);
        Path artifact = dir.resolve("models/model.json");
        JobConfig config = new JobConfig.Builder()
                .dataPath(csv.toString())
                .pipelineConfigPath(yaml.toString())
                .artifactPath(artifact.toString())
                .serverPort(0)
                .build();

        PipelineResult result = ProcessSentinelJob.train(config);

        assertThat(artifact).exists();
        assertThat(result.getPartition().getTest()).hasSize(2);
        assertThat(result.getArtifact().getFeatureColumns()).containsExactly("Mixer/Level", "Mixer/Temperature");

        ScoringServer server = ProcessSentinelJob.serve(config);
        try {
            assertThat(server.isRunning()).isTrue();
            assertThat(server.getPort()).isPositive();
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("Train should require a data path")
    void trainShouldRequireDataPath() {
        JobConfig config = new JobConfig.Builder().build();

        assertThatThrownBy(() -> ProcessSentinelJob.train(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobConfig.ENV_DATA_PATH);
    }

    @Test
    @DisplayName("Train should reject a CSV missing a configured feature column")
    void trainShouldRejectMissingColumn(@TempDir Path dir) throws IOException {
        Path csv = Files.writeString(dir.resolve("runs.csv"),
                "Run id,Timestamp,Anomaly,Mixer/Level\nr1,0,0,0.5\n", StandardCharsets.UTF_8);
        Path yaml = Files.writeString(dir.resolve("pipeline.yml"), PIPELINE_YAML);
        JobConfig config = new JobConfig.Builder()
                .dataPath(csv.toString())
                .pipelineConfigPath(yaml.toString())
                .artifactPath(dir.resolve("model.json").toString())
                .build();

        assertThatThrownBy(() -> ProcessSentinelJob.train(config))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Mixer/Temperature");
    }

    @Test
    @DisplayName("Serve should fail clearly when no artifact exists")
    void serveShouldRequireArtifact(@TempDir Path dir) {
        JobConfig config = new JobConfig.Builder()
                .artifactPath(dir.resolve("absent.json").toString())
                .serverPort(0)
                .build();

        assertThatThrownBy(() -> ProcessSentinelJob.serve(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Main should reject missing or unknown modes")
    void mainShouldRejectBadArguments() {
        assertThatThrownBy(() -> ProcessSentinelJob.main(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(ProcessSentinelJob.USAGE);
        assertThatThrownBy(() -> ProcessSentinelJob.main(new String[] { "evaluate" }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown mode");
    }

    /**
     * Two normal runs, the rest with one anomaly type each on timesteps 8-15.
     */
    private static Path writeRuns(Path path, int runs, int length) throws IOException {
        Random random = new Random(11L);
        StringBuilder csv = new StringBuilder("Run id,Timestamp,Anomaly,Mixer/Level,Mixer/Temperature,Unused\n");
        for (int r = 0; r < runs; r++) {
            int code = r < 2 ? 0 : 1 + r % 3;
            for (int t = 0; t < length; t++) {
                boolean anomalous = code != 0 && t >= 8 && t < 16;
                double level = 0.5 + 0.05 * random.nextGaussian();
                double temperature = 276.0 + 0.5 * random.nextGaussian();
                if (anomalous) {
                    level += code;
                    temperature += 3.0 * code;
                }
                csv.append(String.format(Locale.ROOT, "run-%d,%d,%d,%.4f,%.4f,x%n",
                        r, t, anomalous ? code : 0, level, temperature));
            }
        }
        return Files.writeString(path, csv.toString(), StandardCharsets.UTF_8);
    }
}
