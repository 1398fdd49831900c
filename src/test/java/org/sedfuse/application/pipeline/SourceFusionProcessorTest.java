package org.sedfuse.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.RowCatalogTable;
import org.sedfuse.application.normalize.BandSurveyNormalizer;
import org.sedfuse.application.normalize.CatalogNormalizer;
import org.sedfuse.application.normalize.ExtinctionMapNormalizer;
import org.sedfuse.application.normalize.NormalizationResult;
import org.sedfuse.application.normalize.PositionMatcher;
import org.sedfuse.application.normalize.PrimaryPositionNormalizer;
import org.sedfuse.application.normalize.PrimarySedNormalizer;
import org.sedfuse.application.normalize.UvSurveyNormalizer;
import org.sedfuse.domain.photometry.BandSurvey;
import org.sedfuse.domain.sed.DataSource;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.infrastructure.catalog.SnapshotCatalogGateway;
import org.sedfuse.testutil.InMemoryCatalogGateway;
import org.sedfuse.testutil.RecordingMetricsPort;
import org.sedfuse.testutil.SourceFixtures;
import org.slf4j.LoggerFactory;

class SourceFusionProcessorTest {
  private static final SkyPosition NGC1068 = new SkyPosition(40.66963, -0.01329);

  private final InMemoryCatalogGateway gateway = new InMemoryCatalogGateway();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  static List<CatalogNormalizer> normalizers() {
    PositionMatcher matcher = PositionMatcher.defaults();
    return List.of(
        new PrimaryPositionNormalizer(),
        new ExtinctionMapNormalizer(),
        new PrimarySedNormalizer(),
        new BandSurveyNormalizer(CatalogId.SURVEY_A, BandSurvey.wise(), matcher),
        new BandSurveyNormalizer(CatalogId.SURVEY_B, BandSurvey.twoMass(), matcher),
        new UvSurveyNormalizer(matcher));
  }

  private SourceFusionProcessor processor() {
    return new SourceFusionProcessor(gateway, normalizers(),
        new BandSurveyNormalizer(CatalogId.SURVEY_B, BandSurvey.twoMassInline(), PositionMatcher.defaults()),
        metrics);
  }

  private void byName(CatalogId catalog, String name, RowCatalogTable table) {
    gateway.put(catalog, SnapshotCatalogGateway.key(CatalogQuery.byName(catalog, name)), table);
  }

  private void byPosition(CatalogId catalog, SkyPosition position, RowCatalogTable table) {
    gateway.put(catalog, SnapshotCatalogGateway.key(CatalogQuery.byPosition(catalog, position)), table);
  }

  private static Map<String, Object> wiseRow(SkyPosition at) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("ra", at.lat());
    row.put("dec", at.lon());
    row.put("w1mpro", 7.9);
    row.put("w2mpro", 7.0);
    row.put("w3mpro", 3.5);
    row.put("w4mpro", 0.9);
    return row;
  }

  private void registerPrimary() {
    byName(CatalogId.PRIMARY_POSITION, "NGC1068", RowCatalogTable.of(Map.of(
        PrimaryPositionNormalizer.LAT_COLUMN, NGC1068.lat(),
        PrimaryPositionNormalizer.LON_COLUMN, NGC1068.lon())));
    byPosition(CatalogId.EXTINCTION_MAP, NGC1068, RowCatalogTable.of(Map.of("ebv_sandf_mean", 0.0289)));
    byName(CatalogId.PRIMARY_SED, "NGC1068", RowCatalogTable.of(Map.of(
        PrimarySedNormalizer.FREQUENCY, 1.4e9, PrimarySedNormalizer.FLUX, 4.8)));
  }

  @Test
  void queriesCatalogsInFusionOrder() {
    registerPrimary();
    byPosition(CatalogId.SURVEY_A, NGC1068, RowCatalogTable.of(wiseRow(NGC1068)));
    byPosition(CatalogId.SURVEY_B, NGC1068, RowCatalogTable.of(Map.of(
        "ra", NGC1068.lat(), "dec", NGC1068.lon(), "j_m", 8.0, "h_m", 7.2, "k_m", 6.6)));
    byPosition(CatalogId.UV_SURVEY, NGC1068, RowCatalogTable.of(Map.of(
        "ra", NGC1068.lat(), "dec", NGC1068.lon(), "fuv_flux", 800.0, "nuv_flux", 1500.0, "e_bv", 0.03)));
    Source source = SourceFixtures.named("NGC1068", 40.67, -0.013, 0.003793);

    List<NormalizationResult> results = processor().process(source);

    assertEquals(List.of(CatalogId.values()), gateway.queriedCatalogs());
    assertEquals(6, results.size());
    assertTrue(results.stream().noneMatch(NormalizationResult::isSoftFailure));
    assertEquals(NGC1068, gateway.queries().get(1).position());
    assertEquals(0.0289, source.reddening());
    assertEquals(1 + 4 + 3 + 2, source.measurements().size());
    assertEquals(DataSource.PRIMARY, source.measurements().get(0).dataSource());
    assertEquals(1, metrics.count("sed.catalog.survey_b.accepted"));
  }

  @Test
  void inlineNearInfraredBandsReplaceSecondSurveyQuery() {
    registerPrimary();
    Map<String, Object> row = wiseRow(NGC1068);
    row.put("j_m_2mass", 8.0);
    row.put("h_m_2mass", 7.2);
    row.put("k_m_2mass", 6.6);
    byPosition(CatalogId.SURVEY_A, NGC1068, RowCatalogTable.of(row));
    Source source = SourceFixtures.named("NGC1068", 40.67, -0.013, 0.003793);

    processor().process(source);

    assertFalse(gateway.queriedCatalogs().contains(CatalogId.SURVEY_B));
    List<Measurement> nearIr = source.measurements().stream()
        .filter(m -> m.dataSource() == DataSource.SURVEY_B)
        .toList();
    assertEquals(3, nearIr.size());
    assertEquals(1, metrics.count("sed.catalog.survey_b.accepted"));
  }

  @Test
  void unavailableCatalogIsLoggedAndCounted() {
    registerPrimary();
    gateway.failing(CatalogId.UV_SURVEY);
    Source source = SourceFixtures.named("NGC1068", 40.67, -0.013, 0.003793);

    Logger logger = (Logger) LoggerFactory.getLogger(SourceFusionProcessor.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    List<NormalizationResult> results;
    try {
      results = processor().process(source);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(CatalogId.UV_SURVEY, results.get(results.size() - 1).catalog());
    assertTrue(results.get(results.size() - 1).isSoftFailure());
    assertEquals(1, metrics.count("sed.catalog.uv_survey.failed"));
    assertEquals(1, metrics.count("sed.catalog.survey_a.failed"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("uv_survey(40.66963-0.01329) failed: service unavailable")));
  }

  @Test
  void retriesNameLookupsWithAlternateId() {
    byName(CatalogId.PRIMARY_POSITION, "J0242-0000", RowCatalogTable.of(Map.of(
        PrimaryPositionNormalizer.LAT_COLUMN, NGC1068.lat(),
        PrimaryPositionNormalizer.LON_COLUMN, NGC1068.lon())));
    Source source = new Source(1, "NGC 1068", Optional.of("NGC 1068"), Optional.of("J0242-0000"),
        SkyPosition.UNKNOWN, 0.0038, Map.of());

    List<NormalizationResult> results = processor().process(source);

    assertEquals(List.of(Optional.of("NGC 1068"), Optional.of("J0242-0000")),
        gateway.queries().subList(0, 2).stream().map(CatalogQuery::objectName).toList());
    assertEquals(1, results.get(0).accepted());
    assertEquals(NGC1068, source.searchPosition());
  }

  @Test
  void sourceWithoutNameOrPositionQueriesNothing() {
    Source source = new Source(1, "anon", Optional.empty(), Optional.empty(), SkyPosition.UNKNOWN, 0.1, Map.of());
    assertTrue(processor().process(source).isEmpty());
    assertTrue(gateway.queries().isEmpty());
  }

  @Test
  void everyCatalogNeedsExactlyOneNormalizer() {
    BandSurveyNormalizer inline =
        new BandSurveyNormalizer(CatalogId.SURVEY_B, BandSurvey.twoMassInline(), PositionMatcher.defaults());
    assertThrows(IllegalArgumentException.class,
        () -> new SourceFusionProcessor(gateway, normalizers().subList(0, 5), inline, metrics));
    assertThrows(IllegalArgumentException.class, () -> new SourceFusionProcessor(gateway,
        List.of(new PrimaryPositionNormalizer(), new PrimaryPositionNormalizer()), inline, metrics));
    BandSurveyNormalizer wrongTarget =
        new BandSurveyNormalizer(CatalogId.SURVEY_A, BandSurvey.wise(), PositionMatcher.defaults());
    assertThrows(IllegalArgumentException.class,
        () -> new SourceFusionProcessor(gateway, normalizers(), wrongTarget, metrics));
  }
}
