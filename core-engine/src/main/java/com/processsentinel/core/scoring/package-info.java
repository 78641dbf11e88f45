/**
 * Request-time scoring of raw feature rows against a loaded model artifact.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.scoring;
