package org.sedfuse.domain.sed;

/**
 * <strong>What:</strong> Catalog family that produced a {@link Measurement}.
 * <p><strong>Role:</strong> Domain enumeration used for output labels, plot columns, and metric names.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum DataSource {
  /** Primary position/redshift catalog with its own photometry table. */
  PRIMARY("NED"),
  /** Four-band mid-infrared magnitude survey. */
  SURVEY_A("WISE"),
  /** Three-band near-infrared magnitude survey. */
  SURVEY_B("2MASS"),
  /** Two-band ultraviolet flux survey. */
  UV_SURVEY("GALEX");

  private final String label;

  DataSource(String label) {
    this.label = label;
  }

  /**
   * Returns the short catalog label written to result lines.
   *
   * @return catalog label such as {@code NED}
   */
  public String label() {
    return label;
  }
}
