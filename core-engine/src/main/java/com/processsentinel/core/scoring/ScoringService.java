package com.processsentinel.core.scoring;

import com.processsentinel.core.artifact.ModelArtifact;
import com.processsentinel.core.detection.CascadeEngine;
import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.CascadeResult;
import com.processsentinel.core.model.FeatureSchema;
import com.processsentinel.core.model.ScoringResult;
import com.processsentinel.core.model.Window;
import com.processsentinel.core.preprocessing.ChannelScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores raw feature rows with a loaded model.
 *
 * <p>
 * The service is an explicit context object built once from a
 * {@link ModelArtifact}; it holds no mutable state and may be shared between
 * request threads.
 * </p>
 *
 * <h3>Row semantics</h3>
 * <ol>
 * <li>The rows of one call form one contiguous sequence, in order.</li>
 * <li>Each row is normalized with the stored channel scale.</li>
 * <li>If there are fewer rows than the window length, the sequence is
 * front-padded by repeating the first row.</li>
 * <li>Windows start every {@code stride} rows, plus one window aligned to the
 * end of the sequence, so every row is covered.</li>
 * <li>A row takes the verdict of the covering window with the highest
 * detector probability.</li>
 * </ol>
 *
 * <p>
 * Confidence is {@code 1 - p} for a Normal verdict and {@code p * q(type)}
 * for an anomaly, where {@code p} is the detector probability and
 * {@code q} the classifier distribution. The same products populate
 * {@code all_probabilities}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringService {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringService.class);

    static final String REQUEST_SEQUENCE_ID = "request";

    private final ModelArtifact artifact;
    private final FeatureSchema schema;
    private final ChannelScale scale;
    private final CascadeEngine engine;
    private final SuspectParameterLocator locator;
    private final int windowLength;
    private final int stride;
    private final Clock clock;

    public ScoringService(ModelArtifact artifact) {
        this(artifact, Clock.systemUTC());
    }

    public ScoringService(ModelArtifact artifact, Clock clock) {
        this.artifact = Objects.requireNonNull(artifact, "Artifact must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.schema = artifact.featureSchema();
        this.scale = artifact.getScale();
        this.engine = artifact.toCascadeEngine();
        this.locator = new SuspectParameterLocator(schema);
        this.windowLength = artifact.getWindowLength();
        this.stride = artifact.getStride();
        LOG.info("Scoring service ready: {} features, window {}, stride {}, threshold {}",
                schema.size(), windowLength, stride, engine.getThreshold());
    }

    /**
     * Score named rows. Missing or {@code null} features are filled with
     * {@value FeatureSchema#MISSING_VALUE}; unknown keys are ignored.
     *
     * @throws DataIntegrityException if a value is not a finite number
     */
    public List<ScoringResult> score(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        double[][] vectors = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> row = Objects.requireNonNull(rows.get(i), "Row " + i + " must not be null");
            List<String> missing = schema.missingFrom(row);
            if (!missing.isEmpty()) {
                LOG.debug("Row {}: {} feature(s) missing, filled with {}", i, missing.size(),
                        FeatureSchema.MISSING_VALUE);
            }
            vectors[i] = schema.toVector(row);
        }
        return scoreVectors(vectors);
    }

    /**
     * Score rows already laid out in schema order (raw, unnormalized).
     *
     * @throws DataIntegrityException if a value is NaN or infinite
     */
    public List<ScoringResult> scoreVectors(double[][] rawRows) {
        Objects.requireNonNull(rawRows, "Rows must not be null");
        int n = rawRows.length;
        if (n == 0) {
            return List.of();
        }

        double[][] normalized = new double[n][];
        for (int i = 0; i < n; i++) {
            requireFinite(i, rawRows[i]);
            normalized[i] = scale.apply(rawRows[i]);
        }

        int offset = Math.max(0, windowLength - n);
        double[][] sequence = new double[n + offset][];
        for (int t = 0; t < offset; t++) {
            sequence[t] = normalized[0];
        }
        System.arraycopy(normalized, 0, sequence, offset, n);

        List<Integer> starts = windowStarts(sequence.length);
        List<Window> windows = new ArrayList<>(starts.size());
        for (int start : starts) {
            double[][] slice = new double[windowLength][];
            System.arraycopy(sequence, start, slice, 0, windowLength);
            windows.add(Window.unlabeled(REQUEST_SEQUENCE_ID, start, slice));
        }
        CascadeResult result = engine.infer(windows);

        Instant now = clock.instant();
        List<ScoringResult> results = new ArrayList<>(n);
        for (int row = 0; row < n; row++) {
            int w = decidingWindow(starts, result, row + offset);
            results.add(toResult(row, normalized[row], result, w, now));
        }
        LOG.debug("Scored {} row(s) with {} window(s), {} flagged", n, windows.size(), result.flaggedCount());
        return Collections.unmodifiableList(results);
    }

    private void requireFinite(int rowId, double[] row) {
        Objects.requireNonNull(row, "Row " + rowId + " must not be null");
        for (int f = 0; f < row.length; f++) {
            if (!Double.isFinite(row[f])) {
                String column = f < schema.size() ? schema.columnAt(f) : "#" + f;
                throw new DataIntegrityException("Row " + rowId + ": feature '" + column
                        + "' is not finite: " + row[f]);
            }
        }
    }

    /**
     * Window starts at every stride plus a final window aligned to the end.
     */
    List<Integer> windowStarts(int sequenceLength) {
        List<Integer> starts = new ArrayList<>();
        int last = sequenceLength - windowLength;
        for (int start = 0; start <= last; start += stride) {
            starts.add(start);
        }
        if (starts.get(starts.size() - 1) != last) {
            starts.add(last);
        }
        return starts;
    }

    private int decidingWindow(List<Integer> starts, CascadeResult result, int position) {
        int best = -1;
        for (int w = 0; w < starts.size(); w++) {
            int start = starts.get(w);
            if (position < start || position >= start + windowLength) {
                continue;
            }
            if (best < 0 || result.detectorProbability(w) > result.detectorProbability(best)) {
                best = w;
            }
        }
        return best;
    }

    private ScoringResult toResult(int rowId, double[] normalizedRow, CascadeResult result, int w, Instant now) {
        double p = result.detectorProbability(w);
        AnomalyCode type = result.type(w);
        double[] q = result.typeProbabilities(w);

        Map<String, Double> probabilities = new LinkedHashMap<>();
        probabilities.put(AnomalyCode.NORMAL.getLabel(), 1.0 - p);
        for (AnomalyCode anomalyType : AnomalyCode.anomalyTypes()) {
            probabilities.put(anomalyType.getLabel(),
                    result.isFlagged(w) ? p * q[anomalyType.typeIndex()] : 0.0);
        }

        return ScoringResult.builder()
                .rowId(rowId)
                .anomalous(result.isFlagged(w))
                .anomalyType(type)
                .confidence(probabilities.get(type.getLabel()))
                .detectorProbability(p)
                .parameterForAnomaly(locator.locate(normalizedRow, type))
                .timestamp(now)
                .probabilities(probabilities)
                .build();
    }

    /**
     * @return a JSON-friendly description of the loaded model
     */
    public Map<String, Object> modelInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("model_loaded", true);
        info.put("feature_count", schema.size());
        info.put("anomaly_types", List.of(AnomalyCode.NORMAL.getLabel(), AnomalyCode.FREEZE.getLabel(),
                AnomalyCode.STEP.getLabel(), AnomalyCode.RAMP.getLabel()));
        info.put("feature_columns", schema.getColumns());
        info.put("window_length", windowLength);
        info.put("stride", stride);
        info.put("threshold", engine.getThreshold());
        info.put("classifier_trained", artifact.isClassifierTrained());
        info.put("created_at", artifact.getCreatedAt().toString());
        info.put("metrics", artifact.getMetrics());
        return info;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public int getWindowLength() {
        return windowLength;
    }
}
