/**
 * <strong>Purpose:</strong> Ports separating the fusion pipeline from catalog retrieval, result files, metrics
 * and time.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> The batch pipeline is single-threaded; only {@link
 * org.sedfuse.application.port.MetricsPort} and {@link org.sedfuse.application.port.ClockPort} must be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
package org.sedfuse.application.port;
