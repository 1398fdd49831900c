package org.sedfuse.infrastructure.time;

import java.time.Clock;
import java.util.Objects;
import org.sedfuse.application.port.ClockPort;

/**
 * {@link ClockPort} backed by a {@link Clock}, the UTC system clock unless one is supplied.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter reading the given clock.
   *
   * @param clock time source; must not be {@code null}
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
