/**
 * Run store and tabular ingestion.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.data;
