package org.sedfuse.application.output;

import java.util.Optional;

/**
 * Least-squares power law {@code log10 L = slope * log10 nu + intercept} over the UV window of a plot table.
 *
 * @param slope fitted spectral slope
 * @param intercept fitted intercept in log10 W/Hz
 * @param points number of rows used in the fit
 * @since 0.1.0
 */
public record PowerLawFit(double slope, double intercept, int points) {
  /** Exclusive lower bound of the fitted rest frequency window in Hz. */
  public static final double LOWER_CUTOFF_HZ = 1e15;
  /** Exclusive upper bound of the fitted rest frequency window in Hz. */
  public static final double UPPER_CUTOFF_HZ = 1e17;

  /**
   * Fits rows whose rest frequency lies strictly inside the UV window and whose luminosity is positive.
   *
   * @param frequencies rest frequencies in Hz
   * @param luminosities luminosities in W/Hz, index-aligned with {@code frequencies}
   * @return the fit, or empty when fewer than two distinct frequencies qualify
   */
  public static Optional<PowerLawFit> fit(double[] frequencies, double[] luminosities) {
    if (frequencies.length != luminosities.length) {
      throw new IllegalArgumentException("frequencies and luminosities differ in length");
    }
    double sumX = 0;
    double sumY = 0;
    double sumXx = 0;
    double sumXy = 0;
    int n = 0;
    double firstX = Double.NaN;
    boolean distinct = false;
    for (int i = 0; i < frequencies.length; i++) {
      double nu = frequencies[i];
      double lum = luminosities[i];
      if (!(nu > LOWER_CUTOFF_HZ && nu < UPPER_CUTOFF_HZ) || !(lum > 0) || !Double.isFinite(lum)) {
        continue;
      }
      double x = Math.log10(nu);
      double y = Math.log10(lum);
      if (n == 0) {
        firstX = x;
      } else if (x != firstX) {
        distinct = true;
      }
      sumX += x;
      sumY += y;
      sumXx += x * x;
      sumXy += x * y;
      n++;
    }
    if (n < 2 || !distinct) {
      return Optional.empty();
    }
    double denominator = n * sumXx - sumX * sumX;
    if (denominator == 0) {
      return Optional.empty();
    }
    double slope = (n * sumXy - sumX * sumY) / denominator;
    double intercept = (sumY - slope * sumX) / n;
    return Optional.of(new PowerLawFit(slope, intercept, n));
  }
}
