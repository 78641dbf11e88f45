/**
 * Data preparation stages that sit between the run store and the models.
 *
 * <ul>
 * <li>{@link com.processsentinel.core.preprocessing.RunSplitter} - run-level
 * train/test split</li>
 * <li>{@link com.processsentinel.core.preprocessing.RobustChannelNormalizer} -
 * median/IQR scale fitted on train runs only</li>
 * <li>{@link com.processsentinel.core.preprocessing.WindowExtractor} - labeled
 * sliding windows</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.processsentinel.core.preprocessing;
