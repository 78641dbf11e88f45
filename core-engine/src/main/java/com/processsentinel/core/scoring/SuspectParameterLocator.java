package com.processsentinel.core.scoring;

import com.processsentinel.core.model.AnomalyCode;
import com.processsentinel.core.model.FeatureSchema;

import java.util.Objects;

/**
 * Coarse heuristic naming the feature most likely involved in an anomaly:
 * the one whose normalized value lies furthest from its training median.
 *
 * <p>
 * This is not an explanation of the model's decision.
 * </p>
 *
 * @since 1.0.0
 */
public final class SuspectParameterLocator {

    public static final String NO_ANOMALY = "No Anomaly";

    private final FeatureSchema schema;

    public SuspectParameterLocator(FeatureSchema schema) {
        this.schema = Objects.requireNonNull(schema, "Schema must not be null");
    }

    /**
     * @param normalizedRow the row after channel scaling
     * @param type          the verdict for the row
     * @return a column name, or {@value #NO_ANOMALY} for {@link AnomalyCode#NORMAL}
     */
    public String locate(double[] normalizedRow, AnomalyCode type) {
        if (!type.isAnomalous()) {
            return NO_ANOMALY;
        }
        if (normalizedRow.length != schema.size()) {
            throw new IllegalArgumentException("Expected " + schema.size() + " features, got "
                    + normalizedRow.length);
        }
        int best = 0;
        for (int i = 1; i < normalizedRow.length; i++) {
            if (Math.abs(normalizedRow[i]) > Math.abs(normalizedRow[best])) {
                best = i;
            }
        }
        return schema.columnAt(best);
    }
}
