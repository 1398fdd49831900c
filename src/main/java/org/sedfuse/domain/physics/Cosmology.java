package org.sedfuse.domain.physics;

/**
 * <strong>What:</strong> Flat Lambda-CDM distance calculator used to turn observed flux densities into
 * rest-frame luminosities.
 * <p><strong>Why:</strong> SED plots compare objects at different redshifts, which requires the luminosity
 * distance of each source.</p>
 * <p><strong>Role:</strong> Pure domain service used by the result aggregator when building plot tables.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @implNote The comoving distance integral uses the trapezoidal rule over a fixed number of equal steps;
 *     {@code z == 0} short-circuits to zero distance without integrating.
 * @since 0.1.0
 */
public final class Cosmology {
  /** Matter density parameter. */
  public static final double OMEGA_M = 0.27;
  /** Dark energy density parameter. */
  public static final double OMEGA_LAMBDA = 0.73;
  /** Curvature density parameter. */
  public static final double OMEGA_K = 1.0 - OMEGA_M - OMEGA_LAMBDA;
  /** Hubble constant in km/s/Mpc. */
  public static final double HUBBLE_CONSTANT = 71.0;
  /** Speed of light in m/s. */
  public static final double SPEED_OF_LIGHT = 2.99793e8;
  /** Metres per megaparsec. */
  public static final double METRES_PER_MPC = 3.086e22;
  /** Integration steps over {@code [0, z]}. */
  public static final int INTEGRATION_STEPS = 10_000;

  private static final double JANSKY = 1e-26;

  private static final Cosmology STANDARD = new Cosmology();

  private Cosmology() {}

  /**
   * Returns the calculator for the fixed cosmological parameters.
   *
   * @return shared instance
   */
  public static Cosmology standard() {
    return STANDARD;
  }

  /**
   * Evaluates the dimensionless expansion rate E(z).
   *
   * @param z redshift
   * @return {@code sqrt(Om (1+z)^3 + Ok (1+z)^2 + OL)}
   */
  public double expansionRate(double z) {
    double zp1 = 1.0 + z;
    return Math.sqrt(OMEGA_M * zp1 * zp1 * zp1 + OMEGA_K * zp1 * zp1 + OMEGA_LAMBDA);
  }

  /**
   * Computes the line-of-sight comoving distance.
   *
   * @param z non-negative finite redshift
   * @return comoving distance in Mpc
   * @throws IllegalArgumentException if {@code z} is negative or not finite
   */
  public double comovingDistanceMpc(double z) {
    requireRedshift(z);
    if (z == 0.0) {
      return 0.0;
    }
    double step = z / INTEGRATION_STEPS;
    double sum = 0.5 * (1.0 / expansionRate(0.0) + 1.0 / expansionRate(z));
    for (int i = 1; i < INTEGRATION_STEPS; i++) {
      sum += 1.0 / expansionRate(i * step);
    }
    double integral = sum * step;
    return (SPEED_OF_LIGHT / 1000.0) / HUBBLE_CONSTANT * integral;
  }

  /**
   * Computes the luminosity distance assuming a flat universe (transverse comoving distance equals comoving
   * distance).
   *
   * @param z non-negative finite redshift
   * @return luminosity distance in metres
   */
  public double luminosityDistanceMetres(double z) {
    return (1.0 + z) * comovingDistanceMpc(z) * METRES_PER_MPC;
  }

  /**
   * Converts an observed flux density to rest-frame spectral luminosity.
   *
   * @param z non-negative finite redshift
   * @param fluxDensityJy observed flux density in Jy
   * @param extinctionFactor de-reddening factor applied to the flux
   * @return luminosity in W/Hz; 0 when {@code z == 0}
   */
  public double luminosity(double z, double fluxDensityJy, double extinctionFactor) {
    double distance = luminosityDistanceMetres(z);
    return 4.0 * Math.PI * distance * distance * fluxDensityJy * extinctionFactor * JANSKY / (1.0 + z);
  }

  /**
   * Shifts an observed frequency to the source rest frame.
   *
   * @param z non-negative finite redshift
   * @param observedFrequencyHz observed frequency in Hz
   * @return rest-frame frequency in Hz
   */
  public double restFrequency(double z, double observedFrequencyHz) {
    requireRedshift(z);
    return (1.0 + z) * observedFrequencyHz;
  }

  private static void requireRedshift(double z) {
    if (!Double.isFinite(z) || z < 0) {
      throw new IllegalArgumentException("redshift must be finite and non-negative (was " + z + ")");
    }
  }
}
