package com.processsentinel.core.pipeline;

import com.processsentinel.core.artifact.ModelArtifact;
import com.processsentinel.core.detection.CascadeEngine;
import com.processsentinel.core.detection.EpochMetrics;
import com.processsentinel.core.evaluation.EvaluationReport;
import com.processsentinel.core.model.CascadeResult;
import com.processsentinel.core.model.Partition;
import com.processsentinel.core.preprocessing.ChannelScale;

import java.util.List;

/**
 * Everything produced by one {@link TrainingPipeline#run} call.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final Partition partition;
    private final ChannelScale scale;
    private final int trainWindowCount;
    private final int testWindowCount;
    private final List<EpochMetrics> detectorHistory;
    private final List<EpochMetrics> classifierHistory;
    private final CascadeEngine engine;
    private final CascadeResult testResult;
    private final EvaluationReport report;
    private final ModelArtifact artifact;

    PipelineResult(Partition partition, ChannelScale scale, int trainWindowCount, int testWindowCount,
            List<EpochMetrics> detectorHistory, List<EpochMetrics> classifierHistory,
            CascadeEngine engine, CascadeResult testResult, EvaluationReport report, ModelArtifact artifact) {
        this.partition = partition;
        this.scale = scale;
        this.trainWindowCount = trainWindowCount;
        this.testWindowCount = testWindowCount;
        this.detectorHistory = List.copyOf(detectorHistory);
        this.classifierHistory = List.copyOf(classifierHistory);
        this.engine = engine;
        this.testResult = testResult;
        this.report = report;
        this.artifact = artifact;
    }

    public Partition getPartition() {
        return partition;
    }

    public ChannelScale getScale() {
        return scale;
    }

    public int getTrainWindowCount() {
        return trainWindowCount;
    }

    public int getTestWindowCount() {
        return testWindowCount;
    }

    public List<EpochMetrics> getDetectorHistory() {
        return detectorHistory;
    }

    /**
     * @return empty when the classifier had no anomalous training windows
     */
    public List<EpochMetrics> getClassifierHistory() {
        return classifierHistory;
    }

    public CascadeEngine getEngine() {
        return engine;
    }

    /**
     * @return cascade output over the held-out windows
     */
    public CascadeResult getTestResult() {
        return testResult;
    }

    public EvaluationReport getReport() {
        return report;
    }

    public ModelArtifact getArtifact() {
        return artifact;
    }
}
