package com.processsentinel.core.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.processsentinel.core.detection.CascadeEngine;
import com.processsentinel.core.detection.RecurrentClassifier;
import com.processsentinel.core.detection.RecurrentDetector;
import com.processsentinel.core.model.FeatureSchema;
import com.processsentinel.core.nn.SequenceNetworks;
import com.processsentinel.core.preprocessing.ChannelScale;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to reproduce cascade inference outside the training
 * process: feature layout, fitted channel scale, window geometry, threshold
 * and both networks, each held as a DL4J model zip (base64 in JSON).
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; Jackson uses the annotated constructor when
 * loading. Both paths check that the parts agree on the feature count.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "formatVersion", "createdAt", "featureColumns", "windowLength", "stride",
        "threshold", "classifierTrained", "metrics", "scale", "detector", "classifier" })
public final class ModelArtifact {

    /** Version written by this code; loading rejects any other. */
    public static final int FORMAT_VERSION = 1;

    private final int formatVersion;
    private final Instant createdAt;
    private final List<String> featureColumns;
    private final ChannelScale scale;
    private final int windowLength;
    private final int stride;
    private final double threshold;
    private final byte[] detector;
    private final byte[] classifier;
    private final RecurrentDetector detectorStage;
    private final RecurrentClassifier classifierStage;
    private final boolean classifierTrained;
    private final Map<String, Double> metrics;

    @JsonCreator
    ModelArtifact(@JsonProperty("formatVersion") int formatVersion,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("featureColumns") List<String> featureColumns,
            @JsonProperty("scale") ChannelScale scale,
            @JsonProperty("windowLength") int windowLength,
            @JsonProperty("stride") int stride,
            @JsonProperty("threshold") double threshold,
            @JsonProperty("detector") byte[] detector,
            @JsonProperty("classifier") byte[] classifier,
            @JsonProperty("classifierTrained") boolean classifierTrained,
            @JsonProperty("metrics") Map<String, Double> metrics) {
        if (formatVersion != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported artifact format version " + formatVersion
                    + ", expected " + FORMAT_VERSION);
        }
        this.formatVersion = formatVersion;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.featureColumns = List.copyOf(Objects.requireNonNull(featureColumns, "featureColumns must not be null"));
        this.scale = Objects.requireNonNull(scale, "scale must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null").clone();
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null").clone();
        if (windowLength <= 0 || stride <= 0) {
            throw new IllegalArgumentException("windowLength and stride must be > 0, got: "
                    + windowLength + ", " + stride);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.detectorStage = new RecurrentDetector(SequenceNetworks.fromBytes(this.detector));
        this.classifierStage = new RecurrentClassifier(SequenceNetworks.fromBytes(this.classifier),
                classifierTrained);
        int features = this.featureColumns.size();
        if (scale.featureCount() != features || detectorStage.getFeatureCount() != features
                || classifierStage.getFeatureCount() != features) {
            throw new IllegalArgumentException("Artifact parts disagree on feature count: columns=" + features
                    + ", scale=" + scale.featureCount() + ", detector=" + detectorStage.getFeatureCount()
                    + ", classifier=" + classifierStage.getFeatureCount());
        }
        this.windowLength = windowLength;
        this.stride = stride;
        this.threshold = threshold;
        this.classifierTrained = classifierTrained;
        this.metrics = metrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Rebuilt runtime objects
    // ---------------------------------------------------------------

    @JsonIgnore
    public FeatureSchema featureSchema() {
        return FeatureSchema.of(featureColumns);
    }

    /**
     * @return a cascade engine over the networks restored from this artifact;
     *         engines of one artifact share the network instances
     */
    public CascadeEngine toCascadeEngine() {
        return new CascadeEngine(detectorStage, classifierStage, threshold);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int getFormatVersion() {
        return formatVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public ChannelScale getScale() {
        return scale;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getStride() {
        return stride;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return the serialized detector network
     */
    public byte[] getDetector() {
        return detector.clone();
    }

    /**
     * @return the serialized classifier network
     */
    public byte[] getClassifier() {
        return classifier.clone();
    }

    public boolean isClassifierTrained() {
        return classifierTrained;
    }

    /**
     * @return held-out metrics recorded at training time (informational)
     */
    public Map<String, Double> getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "ModelArtifact{formatVersion=" + formatVersion + ", createdAt=" + createdAt
                + ", features=" + featureColumns.size() + ", windowLength=" + windowLength
                + ", stride=" + stride + ", threshold=" + threshold + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ModelArtifact}. {@code createdAt} defaults to
     * the build time.
     */
    public static final class Builder {
        private Instant createdAt;
        private FeatureSchema schema;
        private ChannelScale scale;
        private int windowLength;
        private int stride;
        private double threshold;
        private RecurrentDetector detector;
        private RecurrentClassifier classifier;
        private final Map<String, Double> metrics = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder schema(FeatureSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder scale(ChannelScale scale) {
            this.scale = scale;
            return this;
        }

        public Builder windowLength(int windowLength) {
            this.windowLength = windowLength;
            return this;
        }

        public Builder stride(int stride) {
            this.stride = stride;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder detector(RecurrentDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder classifier(RecurrentClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * Record a named metric. Non-finite values are not stored.
         */
        public Builder metric(String name, double value) {
            if (Double.isFinite(value)) {
                this.metrics.put(name, value);
            }
            return this;
        }

        public ModelArtifact build() {
            Objects.requireNonNull(schema, "schema must not be null");
            Objects.requireNonNull(detector, "detector must not be null");
            Objects.requireNonNull(classifier, "classifier must not be null");
            return new ModelArtifact(FORMAT_VERSION,
                    createdAt != null ? createdAt : Instant.now(),
                    schema.getColumns(), scale, windowLength, stride, threshold,
                    SequenceNetworks.toBytes(detector.getNetwork()),
                    SequenceNetworks.toBytes(classifier.getNetwork()),
                    classifier.isTrained(), metrics);
        }
    }
}
