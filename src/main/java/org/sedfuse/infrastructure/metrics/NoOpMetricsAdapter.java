package org.sedfuse.infrastructure.metrics;

import org.sedfuse.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; used when metrics are disabled.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
