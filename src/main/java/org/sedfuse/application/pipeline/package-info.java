/**
 * Batch fusion pipeline: per-source catalog orchestration and the input-to-results use case.
 * <p><strong>Concurrency:</strong> Single-threaded and sequential; catalog requests are throttled by the gateway
 * adapter.</p>
 *
 * @since 0.1.0
 */
package org.sedfuse.application.pipeline;
