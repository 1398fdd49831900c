/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound catalog text before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package org.sedfuse.logging;
