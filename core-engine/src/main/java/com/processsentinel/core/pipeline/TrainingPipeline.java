package com.processsentinel.core.pipeline;

import com.processsentinel.core.artifact.ModelArtifact;
import com.processsentinel.core.config.PipelineConfig;
import com.processsentinel.core.data.RunStore;
import com.processsentinel.core.detection.CascadeEngine;
import com.processsentinel.core.detection.ClassifierTrainer;
import com.processsentinel.core.detection.DetectorTrainer;
import com.processsentinel.core.detection.EpochListener;
import com.processsentinel.core.detection.RecurrentClassifier;
import com.processsentinel.core.detection.RecurrentDetector;
import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.evaluation.CascadeEvaluator;
import com.processsentinel.core.evaluation.EvaluationReport;
import com.processsentinel.core.model.CascadeResult;
import com.processsentinel.core.model.FeatureSchema;
import com.processsentinel.core.model.Partition;
import com.processsentinel.core.model.Window;
import com.processsentinel.core.preprocessing.ChannelScale;
import com.processsentinel.core.preprocessing.RobustChannelNormalizer;
import com.processsentinel.core.preprocessing.RunSplitter;
import com.processsentinel.core.preprocessing.WindowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * End-to-end training: split, normalize, window, train both stages, run the
 * cascade on the held-out windows, evaluate and assemble the artifact.
 *
 * <p>
 * The held-out windows double as validation windows during training, so the
 * reported metrics are not an unbiased estimate when an epoch listener stops
 * training based on them.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrainingPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TrainingPipeline.class);

    private final PipelineConfig config;
    private EpochListener epochListener = EpochListener.CONTINUE;

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public TrainingPipeline(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "Pipeline config must not be null");
        config.validate();
    }

    /**
     * Listener passed to both stage trainers.
     */
    public void setEpochListener(EpochListener epochListener) {
        this.epochListener = Objects.requireNonNull(epochListener, "Epoch listener must not be null");
    }

    /**
     * @param store raw, unnormalized runs
     * @throws DataIntegrityException if the store does not match the
     *                                configured feature schema
     * @throws IllegalArgumentException if the window does not fit the shortest
     *                                  run, or the split is degenerate
     */
    public PipelineResult run(RunStore store) {
        Objects.requireNonNull(store, "Run store must not be null");
        FeatureSchema schema = config.featureSchema();
        if (store.featureCount() != schema.size()) {
            throw new DataIntegrityException("Run store has " + store.featureCount()
                    + " features, configuration expects " + schema.size());
        }
        WindowExtractor extractor = new WindowExtractor(config.getWindowLength(), config.getStride());
        extractor.requireFits(store);
        LOG.info("Training pipeline started: {} runs, {} timesteps, {}", store.size(), store.timestepCount(), config);

        Partition partition = new RunSplitter(config.getTestFraction(), config.getSplitSeed(),
                config.isStratifiedSplit()).split(store);
        ChannelScale scale = new RobustChannelNormalizer().fit(store, partition);
        RunStore normalized = scale.apply(store);

        List<Window> trainWindows = extractor.extract(normalized, partition.getTrain());
        List<Window> testWindows = extractor.extract(normalized, partition.getTest());
        LOG.info("Extracted {} train and {} test windows", trainWindows.size(), testWindows.size());

        DetectorTrainer detectorTrainer = new DetectorTrainer(config.detectorSettings(), schema.size());
        detectorTrainer.setEpochListener(epochListener);
        RecurrentDetector detector = detectorTrainer.train(trainWindows, testWindows);

        ClassifierTrainer classifierTrainer = new ClassifierTrainer(config.classifierSettings(), schema.size());
        classifierTrainer.setEpochListener(epochListener);
        RecurrentClassifier classifier = classifierTrainer.train(
                ClassifierTrainer.selectAnomalous(trainWindows),
                ClassifierTrainer.selectAnomalous(testWindows));

        CascadeEngine engine = new CascadeEngine(detector, classifier, config.getThreshold());
        CascadeResult cascade = engine.infer(testWindows);
        EvaluationReport report = CascadeEvaluator.evaluate(testWindows, cascade);
        LOG.info("Held-out evaluation:\n{}", report.format());

        ModelArtifact artifact = ModelArtifact.builder()
                .schema(schema)
                .scale(scale)
                .windowLength(config.getWindowLength())
                .stride(config.getStride())
                .threshold(config.getThreshold())
                .detector(detector)
                .classifier(classifier)
                .metric("detector_balanced_accuracy", report.getDetectorBalancedAccuracy())
                .metric("type_balanced_accuracy", report.getTypeBalancedAccuracy())
                .metric("train_runs", partition.getTrain().size())
                .metric("test_runs", partition.getTest().size())
                .build();

        return new PipelineResult(partition, scale, trainWindows.size(), testWindows.size(),
                detectorTrainer.getHistory(), classifierTrainer.getHistory(),
                engine, cascade, report, artifact);
    }
}
