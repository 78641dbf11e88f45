/**
 * Orchestration of a full training run, from a {@link com.processsentinel.core.data.RunStore}
 * to a {@link com.processsentinel.core.artifact.ModelArtifact}.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.pipeline;
