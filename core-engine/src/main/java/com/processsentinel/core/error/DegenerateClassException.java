package com.processsentinel.core.error;

/**
 * Thrown when a class needed to weight a loss has no examples, for instance a
 * detector training split without a single anomalous window.
 *
 * @since 1.0.0
 */
public class DegenerateClassException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DegenerateClassException(String message) {
        super(message);
    }
}
