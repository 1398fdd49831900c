package org.sedfuse.application.normalize;

import java.util.Optional;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.validation.Numbers;

/**
 * Flat-sky cross-match of catalog detections against a source's search position.
 *
 * <p>Offsets are compared with a tolerance of {@value #FLOAT_SLACK_ARCSEC} arcsec above the configured radius so
 * that a detection lying exactly on the radius is not lost to rounding noise.</p>
 *
 * @since 0.1.0
 */
public final class PositionMatcher {
  /** Default matching radius in arcseconds. */
  public static final double DEFAULT_TOLERANCE_ARCSEC = 10.0;

  static final double FLOAT_SLACK_ARCSEC = 1e-9;

  private final double toleranceArcsec;

  public PositionMatcher(double toleranceArcsec) {
    this.toleranceArcsec = Numbers.requirePositiveFinite("toleranceArcsec", toleranceArcsec);
  }

  public static PositionMatcher defaults() {
    return new PositionMatcher(DEFAULT_TOLERANCE_ARCSEC);
  }

  public double toleranceArcsec() {
    return toleranceArcsec;
  }

  /**
   * Indicates whether an offset lies within the matching radius.
   *
   * @param offsetArcsec offset in arcseconds; NaN never matches
   * @return {@code true} when within tolerance
   */
  public boolean accepts(double offsetArcsec) {
    return Double.isFinite(offsetArcsec) && offsetArcsec <= toleranceArcsec + FLOAT_SLACK_ARCSEC;
  }

  /**
   * Reads the detection position of one row.
   *
   * @param table catalog response
   * @param row row index
   * @param latColumn first coordinate column
   * @param lonColumn second coordinate column
   * @return position, or empty when either coordinate is missing or not finite
   */
  public static Optional<SkyPosition> rowPosition(CatalogTable table, int row, String latColumn, String lonColumn) {
    var lat = table.number(row, latColumn);
    var lon = table.number(row, lonColumn);
    if (lat.isEmpty() || lon.isEmpty()) {
      return Optional.empty();
    }
    SkyPosition position = new SkyPosition(lat.getAsDouble(), lon.getAsDouble());
    return position.isFinite() ? Optional.of(position) : Optional.empty();
  }
}
