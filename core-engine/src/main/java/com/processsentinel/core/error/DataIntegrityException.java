package com.processsentinel.core.error;

/**
 * Thrown when input data violates the ingestion contract: an unknown anomaly
 * code, a missing required column, a non-numeric feature value, a run whose
 * timestamps are not strictly increasing, or a run id that is not assigned to
 * exactly one partition.
 *
 * <p>
 * Data integrity errors are never coerced. The only documented exception is
 * the missing-feature-defaults-to-zero policy at the scoring boundary (see
 * {@link com.processsentinel.core.model.FeatureSchema#toVector(java.util.Map)}).
 * </p>
 *
 * @since 1.0.0
 */
public class DataIntegrityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
