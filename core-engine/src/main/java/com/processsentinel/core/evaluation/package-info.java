/**
 * Held-out evaluation of the cascade: balanced accuracy, confusion matrices
 * and classification reports for the detection and typing stages.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.evaluation;
