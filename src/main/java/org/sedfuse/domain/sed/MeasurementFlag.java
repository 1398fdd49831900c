package org.sedfuse.domain.sed;

/**
 * Marker written alongside each measurement.
 *
 * @since 0.1.0
 */
public enum MeasurementFlag {
  /** Measurement taken from a single catalog detection. */
  SINGLE('a'),
  /** Measurement averaged from more than one raw detection. */
  AVERAGED('m');

  private final char symbol;

  MeasurementFlag(char symbol) {
    this.symbol = symbol;
  }

  /**
   * Returns the single-character marker used in result lines.
   *
   * @return marker character
   */
  public char symbol() {
    return symbol;
  }
}
