package org.sedfuse.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.RowCatalogTable;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.testutil.SourceFixtures;

class PositionMatcherTest {
  private final PositionMatcher matcher = PositionMatcher.defaults();

  @Test
  void toleranceBoundaryIsInclusive() {
    SkyPosition reference = new SkyPosition(150.0, 20.0);
    assertTrue(matcher.accepts(SourceFixtures.shifted(reference, 10.0).offsetArcsec(reference)));
    assertFalse(matcher.accepts(SourceFixtures.shifted(reference, 10.0001).offsetArcsec(reference)));
  }

  @Test
  void nonFiniteOffsetsNeverMatch() {
    assertFalse(matcher.accepts(Double.NaN));
    assertFalse(matcher.accepts(Double.POSITIVE_INFINITY));
  }

  @Test
  void toleranceMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new PositionMatcher(0.0));
    assertThrows(IllegalArgumentException.class, () -> new PositionMatcher(Double.NaN));
    assertEquals(3.0, new PositionMatcher(3.0).toleranceArcsec());
  }

  @Test
  void rowPositionNeedsBothCoordinates() {
    RowCatalogTable table = RowCatalogTable.of(
        Map.of("ra", 10.0, "dec", "-5.5"),
        Map.of("ra", 10.0),
        Map.of("ra", "n/a", "dec", 1.0));
    assertEquals(Optional.of(new SkyPosition(10.0, -5.5)), PositionMatcher.rowPosition(table, 0, "ra", "dec"));
    assertEquals(Optional.empty(), PositionMatcher.rowPosition(table, 1, "ra", "dec"));
    assertEquals(Optional.empty(), PositionMatcher.rowPosition(table, 2, "ra", "dec"));
  }
}
