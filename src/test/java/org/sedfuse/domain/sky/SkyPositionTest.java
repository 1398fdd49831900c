package org.sedfuse.domain.sky;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SkyPositionTest {

  @Test
  void flatSkyOffsetInArcseconds() {
    SkyPosition a = new SkyPosition(10.0, 20.0);
    SkyPosition b = new SkyPosition(10.0 + 3.0 / 3600, 20.0 + 4.0 / 3600);
    assertEquals(5.0, a.offsetArcsec(b), 1e-9);
    assertEquals(a.offsetArcsec(b), b.offsetArcsec(a), 0.0);
  }

  @Test
  void unknownPositionHasNoOffset() {
    assertFalse(SkyPosition.UNKNOWN.isFinite());
    assertTrue(Double.isNaN(SkyPosition.UNKNOWN.offsetArcsec(new SkyPosition(1, 1))));
    assertTrue(Double.isNaN(new SkyPosition(1, 1).offsetArcsec(null)));
  }

  @Test
  void coordinateStringCarriesSignedDeclination() {
    assertEquals("150.12346-2.50000", new SkyPosition(150.123456, -2.5).toCoordinateString());
    assertEquals("1.00000+2.00000", new SkyPosition(1, 2).toCoordinateString());
  }
}
