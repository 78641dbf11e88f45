/**
 * Configuration loading and validation for the training pipeline.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.processsentinel.core.config.PipelineConfigLoader} into a
 * {@link com.processsentinel.core.config.PipelineConfig}. Validation runs
 * right after parsing so configuration errors surface before training.
 * </p>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.config;
