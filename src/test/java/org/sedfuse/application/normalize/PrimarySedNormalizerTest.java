package org.sedfuse.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.RowCatalogTable;
import org.sedfuse.domain.sed.DataSource;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.testutil.SourceFixtures;

class PrimarySedNormalizerTest {
  private final PrimarySedNormalizer normalizer = new PrimarySedNormalizer();

  private static Map<String, Object> row(Object frequency, Object flux, String comments, String passband) {
    Map<String, Object> row = new HashMap<>();
    row.put(PrimarySedNormalizer.FREQUENCY, frequency);
    row.put(PrimarySedNormalizer.FLUX, flux);
    row.put(PrimarySedNormalizer.REFCODE, "2003AJ....125..525J");
    row.put(PrimarySedNormalizer.COMMENTS, comments);
    row.put(PrimarySedNormalizer.PASSBAND, passband);
    return row;
  }

  @Test
  void keepsOnlyUsableTotalFluxRows() {
    Source source = SourceFixtures.named("3C 273", 187.27, 2.05, 0.158);
    source.resolvePrimaryPosition(new SkyPosition(187.2779, 2.0524));

    NormalizationResult result = normalizer.normalize(source, RowCatalogTable.of(
        row(1.4e9, 46.9, "Total flux", "1.4 GHz (VLA)"),
        row(4.6e14, 0.02, "[OIII] line", "5007 A"),
        row("1.38e14", "0.1", "", "H (2MASS)"),
        row(2.4e14, -1.0, "", "J (2MASS)"),
        row(5e14, 0.03, "", "F555W (HST)")));

    assertEquals(2, result.accepted());
    List<Measurement> measurements = source.measurements();
    assertEquals(List.of(1.4e9, 1.38e14), measurements.stream().map(Measurement::frequencyHz).toList());
    Measurement first = measurements.get(0);
    assertEquals(DataSource.PRIMARY, first.dataSource());
    assertEquals(0.0, first.offsetFromReferenceArcsec());
    assertEquals(new SkyPosition(187.2779, 2.0524), first.position());
    assertEquals("12.5", first.extras().get("rm"));
  }

  @Test
  void fallsBackToAlternateFluxColumn() {
    Source source = SourceFixtures.at(1, 1);
    NormalizationResult result = normalizer.normalize(source, RowCatalogTable.of(
        Map.of(PrimarySedNormalizer.FREQUENCY, 1e10, PrimarySedNormalizer.FLUX_FALLBACK, 2.5)));
    assertEquals(1, result.accepted());
    assertEquals(2.5, source.measurements().get(0).fluxDensityJy());
  }

  @Test
  void missingColumnsAreSoftFailure() {
    NormalizationResult result = normalizer.normalize(SourceFixtures.at(1, 1),
        RowCatalogTable.of(Map.of(PrimarySedNormalizer.FREQUENCY, 1e10)));
    assertEquals("frequency or flux column missing", result.failure().orElseThrow());
  }

  @Test
  void fullyFilteredTableIsSoftFailure() {
    NormalizationResult result = normalizer.normalize(SourceFixtures.at(1, 1),
        RowCatalogTable.of(row(1e10, 1.0, "model SED", "")));
    assertTrue(result.isSoftFailure());
  }
}
