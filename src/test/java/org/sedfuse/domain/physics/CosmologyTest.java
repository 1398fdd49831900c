package org.sedfuse.domain.physics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CosmologyTest {
  private final Cosmology cosmology = Cosmology.standard();

  @Test
  void zeroRedshiftHasZeroDistanceAndLuminosity() {
    assertEquals(0.0, cosmology.comovingDistanceMpc(0.0));
    assertEquals(0.0, cosmology.luminosity(0.0, 1.0, 1.0));
  }

  @Test
  void comovingDistanceAtRedshiftOneMatchesFlatLambdaCdm() {
    double distance = cosmology.comovingDistanceMpc(1.0);
    assertEquals(3317.4, distance, 0.5);
  }

  @Test
  void luminosityDistanceScalesComovingDistance() {
    double z = 0.5;
    assertEquals(1.5 * cosmology.comovingDistanceMpc(z) * Cosmology.METRES_PER_MPC,
        cosmology.luminosityDistanceMetres(z), 1e10);
  }

  @Test
  void luminosityIsLinearInCorrectedFlux() {
    double z = 0.2;
    double base = cosmology.luminosity(z, 1e-3, 1.0);
    assertTrue(base > 0);
    assertEquals(2 * base, cosmology.luminosity(z, 1e-3, 2.0), base * 1e-12);
    assertEquals(2 * base, cosmology.luminosity(z, 2e-3, 1.0), base * 1e-12);
  }

  @Test
  void restFrequencyShiftsByOnePlusZ() {
    assertEquals(2e14, cosmology.restFrequency(1.0, 1e14), 1.0);
    assertEquals(1e14, cosmology.restFrequency(0.0, 1e14));
  }

  @Test
  void negativeRedshiftRejected() {
    assertThrows(IllegalArgumentException.class, () -> cosmology.comovingDistanceMpc(-0.1));
    assertThrows(IllegalArgumentException.class, () -> cosmology.restFrequency(Double.NaN, 1e14));
  }

  @Test
  void expansionRateIsOneToday() {
    assertEquals(1.0, cosmology.expansionRate(0.0), 1e-12);
  }
}
