/**
 * Domain model classes for Process Sentinel.
 *
 * <ul>
 * <li>{@link com.processsentinel.core.model.AnomalyCode} - closed set of
 * timestep labels</li>
 * <li>{@link com.processsentinel.core.model.FeatureSchema} - ordered feature
 * columns and the missing-field policy</li>
 * <li>{@link com.processsentinel.core.model.Run} - one recorded trial</li>
 * <li>{@link com.processsentinel.core.model.Partition} - run-level train/test
 * split</li>
 * <li>{@link com.processsentinel.core.model.Window} - labeled fixed-length
 * slice of a run</li>
 * <li>{@link com.processsentinel.core.model.ScoringResult} - per-row output of
 * the scoring function</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.model;
