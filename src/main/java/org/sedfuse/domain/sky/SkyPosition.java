package org.sedfuse.domain.sky;

import java.util.Locale;

/**
 * <strong>What:</strong> Equatorial sky position (J2000 decimal degrees) used for catalog cross-matching.
 * <p><strong>Why:</strong> Every catalog lookup and tolerance decision is driven by the separation between two
 * positions, and an unresolved position must remain representable rather than {@code null}.</p>
 * <p><strong>Role:</strong> Domain value object shared by sources, measurements, and catalog queries.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param lat first coordinate in degrees (right ascension in the catalogs consumed here); may be NaN
 * @param lon second coordinate in degrees (declination); may be NaN
 * @implNote Separation uses the flat-sky approximation {@code hypot(dLat, dLon) * 3600} without a
 *     cos(declination) term; tolerance decisions downstream depend on this exact form.
 * @since 0.1.0
 */
public record SkyPosition(double lat, double lon) {
  /** Arcseconds per degree. */
  public static final double ARCSEC_PER_DEGREE = 3600.0;

  /** Position that has not been resolved. */
  public static final SkyPosition UNKNOWN = new SkyPosition(Double.NaN, Double.NaN);

  /**
   * Indicates whether both coordinates are finite numbers.
   *
   * @return {@code true} when the position can be used numerically
   */
  public boolean isFinite() {
    return Double.isFinite(lat) && Double.isFinite(lon);
  }

  /**
   * Returns the flat-sky angular separation between this position and {@code other}.
   *
   * @param other second position; must not be {@code null}
   * @return separation in arcseconds, or NaN when either position is not finite
   */
  public double offsetArcsec(SkyPosition other) {
    if (!isFinite() || other == null || !other.isFinite()) {
      return Double.NaN;
    }
    return Math.hypot(lat - other.lat, lon - other.lon) * ARCSEC_PER_DEGREE;
  }

  /**
   * Formats the position rounded to five decimals, e.g. {@code 197.16317-9.84211}.
   *
   * @return compact coordinate string suitable as a synthesized object identity
   */
  public String toCoordinateString() {
    return String.format(Locale.ROOT, "%.5f%+.5f", lat, lon);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "(%.5f, %.5f)", lat, lon);
  }
}
