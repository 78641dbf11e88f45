package com.processsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict for one raw feature row returned by the scoring function.
 *
 * <p>
 * Serialized to JSON by the HTTP layer using snake_case property names.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code anomalyType} and {@code timestamp} are
 * required; omitting either throws a {@link NullPointerException} at build
 * time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "row_id", "anomalous", "anomaly_type", "anomaly_code", "confidence",
        "detector_probability", "parameter_for_anomaly", "timestamp", "all_probabilities" })
public class ScoringResult {

    /** Position of the row in the scored batch. */
    private final int rowId;

    /** Cascade stage-1 decision. */
    private final boolean anomalous;

    /** NORMAL when not anomalous, otherwise the stage-2 type. */
    private final AnomalyCode anomalyType;

    /** Probability of the reported label under the cascade. */
    private final double confidence;

    /** Raw stage-1 probability of the window that decided this row. */
    private final double detectorProbability;

    /** Suspected parameter (coarse heuristic) or "No Anomaly". */
    private final String parameterForAnomaly;

    private final Instant timestamp;

    /** Label to probability for every {@link AnomalyCode}. */
    private final Map<String, Double> probabilities;

    private ScoringResult(Builder builder) {
        this.rowId = builder.rowId;
        this.anomalous = builder.anomalous;
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.confidence = builder.confidence;
        this.detectorProbability = builder.detectorProbability;
        this.parameterForAnomaly = builder.parameterForAnomaly;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.probabilities = builder.probabilities != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.probabilities))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ScoringResult} instances.
     */
    public static class Builder {
        private int rowId;
        private boolean anomalous;
        private AnomalyCode anomalyType;
        private double confidence;
        private double detectorProbability;
        private String parameterForAnomaly;
        private Instant timestamp;
        private Map<String, Double> probabilities;

        public Builder rowId(int rowId) {
            this.rowId = rowId;
            return this;
        }

        public Builder anomalous(boolean anomalous) {
            this.anomalous = anomalous;
            return this;
        }

        public Builder anomalyType(AnomalyCode anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder detectorProbability(double detectorProbability) {
            this.detectorProbability = detectorProbability;
            return this;
        }

        public Builder parameterForAnomaly(String parameterForAnomaly) {
            this.parameterForAnomaly = parameterForAnomaly;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder probabilities(Map<String, Double> probabilities) {
            this.probabilities = probabilities;
            return this;
        }

        public ScoringResult build() {
            return new ScoringResult(this);
        }
    }

    @JsonProperty("row_id")
    public int getRowId() {
        return rowId;
    }

    @JsonProperty("anomalous")
    public boolean isAnomalous() {
        return anomalous;
    }

    @JsonIgnore
    public AnomalyCode getAnomalyType() {
        return anomalyType;
    }

    @JsonProperty("anomaly_type")
    public String getAnomalyTypeLabel() {
        return anomalyType.getLabel();
    }

    @JsonProperty("anomaly_code")
    public int getAnomalyCode() {
        return anomalyType.getCode();
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("detector_probability")
    public double getDetectorProbability() {
        return detectorProbability;
    }

    @JsonProperty("parameter_for_anomaly")
    public String getParameterForAnomaly() {
        return parameterForAnomaly;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("all_probabilities")
    public Map<String, Double> getProbabilities() {
        return probabilities;
    }

    @Override
    public String toString() {
        return "ScoringResult{" +
                "rowId=" + rowId +
                ", anomalous=" + anomalous +
                ", anomalyType=" + anomalyType +
                ", confidence=" + confidence +
                ", parameterForAnomaly='" + parameterForAnomaly + '\'' +
                '}';
    }
}
