package org.sedfuse.infrastructure.catalog;

import java.util.Objects;
import java.util.Optional;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.CatalogUnavailableException;
import org.sedfuse.application.port.CatalogGateway;
import org.sedfuse.application.port.ClockPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator enforcing a minimum delay between consecutive catalog requests.
 *
 * <p>The delay is measured from the start of the previous request. An interrupted wait restores the interrupt
 * flag and surfaces as {@link CatalogUnavailableException}.</p>
 *
 * @since 0.1.0
 */
public final class ThrottlingCatalogGateway implements CatalogGateway {
  private static final Logger log = LoggerFactory.getLogger(ThrottlingCatalogGateway.class);

  private final CatalogGateway delegate;
  private final long delayMillis;
  private final ClockPort clock;
  private final Sleeper sleeper;
  private long lastRequestMillis = Long.MIN_VALUE;

  public ThrottlingCatalogGateway(CatalogGateway delegate, long delayMillis, ClockPort clock) {
    this(delegate, delayMillis, clock, Thread::sleep);
  }

  ThrottlingCatalogGateway(CatalogGateway delegate, long delayMillis, ClockPort clock, Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must be >= 0");
    }
    this.delayMillis = delayMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public Optional<CatalogTable> fetch(CatalogQuery query) throws CatalogUnavailableException {
    if (delayMillis > 0 && lastRequestMillis != Long.MIN_VALUE) {
      long wait = lastRequestMillis + delayMillis - clock.nowMillis();
      if (wait > 0) {
        log.trace("Throttling {} for {} ms", query.describe(), wait);
        try {
          sleeper.sleep(wait);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new CatalogUnavailableException(query.catalog(), "interrupted while throttling", ex);
        }
      }
    }
    lastRequestMillis = clock.nowMillis();
    return delegate.fetch(query);
  }

  public long delayMillis() {
    return delayMillis;
  }

  /** Blocking wait, replaceable in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
