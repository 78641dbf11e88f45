/**
 * Executable job: environment-driven configuration, the {@code train} and
 * {@code serve} entry points, and the HTTP scoring endpoint.
 *
 * @since 1.0.0
 */
package com.processsentinel.job;
