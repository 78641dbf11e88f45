/**
 * DL4J plumbing shared by both cascade stages:
 * {@link com.processsentinel.core.nn.SequenceNetworks} (LSTM network
 * construction, batched inference, model zip serialization) and
 * {@link com.processsentinel.core.nn.WindowTensors} (window to ND4J array
 * layout).
 *
 * @since 1.0.0
 */
package com.processsentinel.core.nn;
