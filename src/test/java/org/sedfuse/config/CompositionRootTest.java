package org.sedfuse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.RowCatalogTable;
import org.sedfuse.application.normalize.CatalogNormalizer;
import org.sedfuse.application.normalize.PrimarySedNormalizer;
import org.sedfuse.application.pipeline.BatchSummary;
import org.sedfuse.infrastructure.catalog.SnapshotCatalogGateway;
import org.sedfuse.infrastructure.catalog.ThrottlingCatalogGateway;
import org.sedfuse.testutil.InMemoryCatalogGateway;
import org.sedfuse.testutil.InMemoryResultSink;
import org.sedfuse.testutil.RecordingMetricsPort;

class CompositionRootTest {

  @Test
  void compilesGrammarAndTemplate() {
    CompositionRoot root = new CompositionRoot(FuseConfig.fromMap(Map.of("in", "sources.txt")), new RecordingMetricsPort());
    assertEquals(List.of("rm", "rm_err"), root.grammar().extraFieldNames());
    assertEquals(15, root.template().fieldNames().size());
  }

  @Test
  void wiresOneNormalizerPerCatalogInOrder() {
    CompositionRoot root = new CompositionRoot(
        FuseConfig.fromMap(Map.of("in", "sources.txt", "requestDelayMillis", "250")), new RecordingMetricsPort());
    assertEquals(List.of(CatalogId.values()),
        root.normalizers().stream().map(CatalogNormalizer::catalog).toList());
    ThrottlingCatalogGateway gateway = assertInstanceOf(ThrottlingCatalogGateway.class, root.catalogGateway());
    assertEquals(250L, gateway.delayMillis());
  }

  @Test
  void customFieldsNeedMatchingTemplate() {
    Map<String, String> options = Map.of("in", "sources.txt", "fields", "lat,lon,name,z");
    assertThrows(IllegalArgumentException.class,
        () -> new CompositionRoot(FuseConfig.fromMap(options), new RecordingMetricsPort()));

    Map<String, String> withTemplate = Map.of("in", "sources.txt", "fields", "lat,lon,name,z,band",
        "template", "{name} {band} {flux:%.3e}");
    CompositionRoot root = new CompositionRoot(FuseConfig.fromMap(withTemplate), new RecordingMetricsPort());
    assertEquals(List.of("band"), root.grammar().extraFieldNames());
  }

  @Test
  void assembledUseCaseRunsEndToEnd() throws IOException {
    Map<String, String> options = Map.of("in", "sources.txt", "fields", "name,z,survey",
        "template", "{name} {freq:%.2e} {survey}", "plot", "false", "requestDelayMillis", "0");
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CompositionRoot root = new CompositionRoot(FuseConfig.fromMap(options), metrics, () -> 0L);
    InMemoryCatalogGateway gateway = new InMemoryCatalogGateway()
        .put(CatalogId.PRIMARY_SED, SnapshotCatalogGateway.key(CatalogQuery.byName(CatalogId.PRIMARY_SED, "M87")),
            RowCatalogTable.of(Map.of(PrimarySedNormalizer.FREQUENCY, 1.4e9, PrimarySedNormalizer.FLUX, 210.0)));
    InMemoryResultSink sink = new InMemoryResultSink();

    BatchSummary summary = root.sedFusionUseCase(gateway, sink)
        .run(new BufferedReader(new StringReader("M87 0.00428 VLA\n")));

    assertEquals(1, summary.measurementsWritten());
    assertEquals(List.of("M87 1.40e+09 VLA"), sink.lines());
    assertEquals(1, metrics.count("sed.catalog.primary_sed.accepted"));
  }
}
