/**
 * Domain exceptions raised by the pipeline.
 *
 * <p>
 * All of them extend {@link java.lang.IllegalStateException} so callers that
 * only care about "the pipeline refused to continue" can catch one type.
 * Configuration errors use the plain JDK
 * {@link java.lang.IllegalArgumentException} / {@link java.lang.IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.error;
