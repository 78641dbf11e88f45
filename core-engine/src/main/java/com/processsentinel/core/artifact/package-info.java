/**
 * Persistent model artifact and its JSON store.
 *
 * @since 1.0.0
 */
package com.processsentinel.core.artifact;
