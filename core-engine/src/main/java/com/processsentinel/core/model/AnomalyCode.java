package com.processsentinel.core.model;

import com.processsentinel.core.error.DataIntegrityException;

import java.util.List;

/**
 * Closed set of ground-truth anomaly codes stamped on every timestep.
 *
 * <p>
 * The numeric code is the on-disk value. Non-normal codes additionally have a
 * dense <em>type index</em> ({@code code - 1}) used as the output index of the
 * stage-2 classifier, which never predicts {@link #NORMAL}.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyCode {

    NORMAL(0, "Normal"),
    FREEZE(1, "Freeze"),
    STEP(2, "Step"),
    RAMP(3, "Ramp");

    private static final AnomalyCode[] BY_CODE = values();
    private static final List<AnomalyCode> ANOMALY_TYPES = List.of(FREEZE, STEP, RAMP);

    private final int code;
    private final String label;

    AnomalyCode(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAnomalous() {
        return this != NORMAL;
    }

    /**
     * @return the classifier output index of this anomaly type
     * @throws IllegalStateException if called on {@link #NORMAL}
     */
    public int typeIndex() {
        if (this == NORMAL) {
            throw new IllegalStateException("NORMAL has no anomaly type index");
        }
        return code - 1;
    }

    /**
     * Resolve a numeric anomaly code.
     *
     * @param code the code as stored in the input data
     * @return the matching constant
     * @throws DataIntegrityException if the code is not in {0, 1, 2, 3}
     */
    public static AnomalyCode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new DataIntegrityException("Unknown anomaly code: " + code
                    + ". Supported codes: 0 (Normal), 1 (Freeze), 2 (Step), 3 (Ramp)");
        }
        return BY_CODE[code];
    }

    /**
     * @param typeIndex classifier output index in {@code [0, typeCount())}
     * @return the anomaly type at that index
     */
    public static AnomalyCode fromTypeIndex(int typeIndex) {
        if (typeIndex < 0 || typeIndex >= ANOMALY_TYPES.size()) {
            throw new IllegalArgumentException("Anomaly type index out of range: " + typeIndex);
        }
        return ANOMALY_TYPES.get(typeIndex);
    }

    /**
     * Arg-max of a classifier distribution, lowest type index on ties.
     *
     * @throws IllegalArgumentException if the distribution does not have
     *                                  {@link #typeCount()} entries
     */
    public static AnomalyCode mostLikelyType(double[] distribution) {
        if (distribution == null || distribution.length != ANOMALY_TYPES.size()) {
            throw new IllegalArgumentException("Type distribution must have " + ANOMALY_TYPES.size()
                    + " entries, got: " + (distribution == null ? "null" : distribution.length));
        }
        int best = 0;
        for (int k = 1; k < distribution.length; k++) {
            if (distribution[k] > distribution[best]) {
                best = k;
            }
        }
        return ANOMALY_TYPES.get(best);
    }

    /**
     * @return the non-normal codes in type-index order
     */
    public static List<AnomalyCode> anomalyTypes() {
        return ANOMALY_TYPES;
    }

    public static int typeCount() {
        return ANOMALY_TYPES.size();
    }
}
