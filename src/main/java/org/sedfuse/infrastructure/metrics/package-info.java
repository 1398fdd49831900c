/**
 * Metrics adapters: OpenTelemetry export and a no-op fallback.
 *
 * @since 0.1.0
 */
package org.sedfuse.infrastructure.metrics;
