package org.sedfuse.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.RowCatalogTable;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.testutil.SourceFixtures;

class PrimaryPositionNormalizerTest {
  private final PrimaryPositionNormalizer normalizer = new PrimaryPositionNormalizer();

  @Test
  void resolvesPositionAndInputOffset() {
    Source source = SourceFixtures.at(150.0, 2.0);
    NormalizationResult result = normalizer.normalize(source, RowCatalogTable.of(Map.of(
        PrimaryPositionNormalizer.LAT_COLUMN, 150.0,
        PrimaryPositionNormalizer.LON_COLUMN, 2.001)));

    assertEquals(1, result.accepted());
    assertEquals(new SkyPosition(150.0, 2.001), source.searchPosition());
    assertEquals(3.6, source.inputOffsetArcsec(), 1e-6);
  }

  @Test
  void missingColumnLeavesInputPosition() {
    Source source = SourceFixtures.at(150.0, 2.0);
    NormalizationResult result = normalizer.normalize(source,
        RowCatalogTable.of(Map.of(PrimaryPositionNormalizer.LAT_COLUMN, 150.0)));
    assertTrue(result.isSoftFailure());
    assertEquals(new SkyPosition(150.0, 2.0), source.searchPosition());
  }

  @Test
  void emptyResponseIsSoftFailure() {
    assertEquals("empty response",
        normalizer.normalize(SourceFixtures.at(1, 1), RowCatalogTable.empty()).failure().orElseThrow());
  }
}
