package com.processsentinel.job;

import com.processsentinel.core.artifact.ArtifactStore;
import com.processsentinel.core.artifact.ModelArtifact;
import com.processsentinel.core.config.PipelineConfig;
import com.processsentinel.core.config.PipelineConfigLoader;
import com.processsentinel.core.data.CsvRunReader;
import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.pipeline.PipelineResult;
import com.processsentinel.core.pipeline.TrainingPipeline;
import com.processsentinel.core.scoring.ScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for Process Sentinel.
 *
 * <h3>Modes</h3>
 *
 * <pre>
 *   train : CSV (DATA_PATH) -> training pipeline -> model artifact (ARTIFACT_PATH)
 *   serve : model artifact (ARTIFACT_PATH) -> scoring service -> HTTP (SERVER_PORT)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All job settings are resolved from environment variables via
 * {@link JobConfig}; pipeline hyper-parameters come from the YAML file
 * resolved by {@link PipelineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessSentinelJob.class);

    static final String USAGE = "Usage: ProcessSentinelJob <train|serve>";

    private ProcessSentinelJob() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        if (args.length != 1) {
            throw new IllegalArgumentException(USAGE);
        }
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Process Sentinel ({}) with config: {}", args[0], config);

        switch (args[0].toLowerCase(Locale.ROOT)) {
            case "train" -> train(config);
            case "serve" -> {
                ScoringServer server = serve(config);
                CountDownLatch stopped = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    server.stop();
                    stopped.countDown();
                }, "scoring-shutdown"));
                stopped.await();
            }
            default -> throw new IllegalArgumentException("Unknown mode '" + args[0] + "'. " + USAGE);
        }
    }

    // ---------------------------------------------------------------
    // Modes (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Train on the CSV at {@link JobConfig#getDataPath()} and write the
     * artifact.
     *
     * @throws IllegalArgumentException if no data path is configured
     */
    static PipelineResult train(JobConfig config) {
        if (config.getDataPath().isBlank()) {
            throw new IllegalArgumentException(JobConfig.ENV_DATA_PATH + " must be set for training");
        }
        PipelineConfig pipelineConfig = loadPipelineConfig(config);
        RunStore store = CsvRunReader.fromConfig(pipelineConfig).read(Path.of(config.getDataPath()));

        PipelineResult result = new TrainingPipeline(pipelineConfig).run(store);
        new ArtifactStore().save(result.getArtifact(), Path.of(config.getArtifactPath()));
        return result;
    }

    /**
     * Load the artifact and start the scoring server.
     */
    static ScoringServer serve(JobConfig config) {
        ModelArtifact artifact = new ArtifactStore().load(Path.of(config.getArtifactPath()));
        ScoringServer server = new ScoringServer(new ScoringService(artifact));
        server.start(config.getServerPort());
        return server;
    }

    private static PipelineConfig loadPipelineConfig(JobConfig config) {
        String path = config.getPipelineConfigPath();
        if (path != null && !path.isBlank()) {
            return PipelineConfigLoader.fromFile(path);
        }
        return PipelineConfigLoader.load();
    }
}
