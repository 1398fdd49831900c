package org.sedfuse.domain.physics;

/**
 * <strong>What:</strong> Cardelli, Clayton &amp; Mathis (1989) interstellar extinction law.
 * <p><strong>Why:</strong> Observed fluxes are dimmed by Galactic dust along the line of sight; the correction
 * factor returned here multiplies an observed flux density to recover the de-reddened value.</p>
 * <p><strong>Role:</strong> Pure domain function applied to every measurement at construction time.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>Coverage is {@code 0.3 <= x <= 8} inverse micrometres; outside it the law contributes nothing and the
 * factor is exactly 1.</p>
 *
 * @since 0.1.0
 */
public final class ExtinctionLaw {
  /** Ratio of total to selective extinction. */
  public static final double R_V = 3.1;
  /** Speed of light in m/s. */
  public static final double SPEED_OF_LIGHT = 2.99793e8;

  private static final double[] OPTICAL_A =
      {1.0, 0.17699, -0.50447, -0.02427, 0.72085, 0.01979, -0.77530, 0.32999};
  private static final double[] OPTICAL_B =
      {0.0, 1.41338, 2.28305, 1.07233, -5.38434, -0.62251, 5.30260, -2.09002};

  private ExtinctionLaw() {}

  /**
   * Returns the multiplicative flux correction for the given colour excess and frequency.
   *
   * @param reddening colour excess E(B-V); non-finite or non-positive values disable the correction
   * @param frequencyHz observed frequency in Hz
   * @return correction factor {@code 10^(0.4 * A)}; 1.0 when no correction applies
   */
  public static double correctionFactor(double reddening, double frequencyHz) {
    if (!Double.isFinite(reddening) || reddening <= 0 || !Double.isFinite(frequencyHz)) {
      return 1.0;
    }
    double x = waveNumber(frequencyHz);
    Coefficients c = coefficients(x);
    double extinction = reddening * (c.a() + c.b() / R_V);
    return Math.pow(10.0, 0.4 * extinction);
  }

  /**
   * Converts a frequency to a wave number.
   *
   * @param frequencyHz frequency in Hz
   * @return wave number in inverse micrometres
   */
  public static double waveNumber(double frequencyHz) {
    return frequencyHz / (SPEED_OF_LIGHT * 1e6);
  }

  static Coefficients coefficients(double x) {
    if (x >= 0.3 && x <= 1.1) {
      double p = Math.pow(x, 1.61);
      return new Coefficients(0.574 * p, -0.527 * p);
    }
    if (x > 1.1 && x <= 3.3) {
      double y = x - 1.82;
      return new Coefficients(polynomial(OPTICAL_A, y), polynomial(OPTICAL_B, y));
    }
    if (x > 3.3 && x <= 8.0) {
      double fa = 0.0;
      double fb = 0.0;
      if (x >= 5.9) {
        double d = x - 5.9;
        fa = -0.04473 * d * d - 0.009779 * d * d * d;
        fb = 0.2130 * d * d + 0.1207 * d * d * d;
      }
      double a = 1.752 - 0.316 * x - 0.104 / ((x - 4.67) * (x - 4.67) + 0.341) + fa;
      double b = -3.090 + 1.825 * x + 1.206 / ((x - 4.62) * (x - 4.62) + 0.263) + fb;
      return new Coefficients(a, b);
    }
    return new Coefficients(0.0, 0.0);
  }

  private static double polynomial(double[] coefficients, double y) {
    double result = 0.0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      result = result * y + coefficients[i];
    }
    return result;
  }

  record Coefficients(double a, double b) {}
}
