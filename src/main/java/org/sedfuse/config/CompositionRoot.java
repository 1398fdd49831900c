package org.sedfuse.config;

import java.util.List;
import java.util.Objects;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.normalize.BandSurveyNormalizer;
import org.sedfuse.application.normalize.CatalogNormalizer;
import org.sedfuse.application.normalize.ExtinctionMapNormalizer;
import org.sedfuse.application.normalize.PositionMatcher;
import org.sedfuse.application.normalize.PrimaryPositionNormalizer;
import org.sedfuse.application.normalize.PrimarySedNormalizer;
import org.sedfuse.application.normalize.SedRowFilter;
import org.sedfuse.application.normalize.UvSurveyNormalizer;
import org.sedfuse.application.output.OutputTemplate;
import org.sedfuse.application.output.ResultAggregator;
import org.sedfuse.application.parse.InputGrammar;
import org.sedfuse.application.parse.InputLineParser;
import org.sedfuse.application.pipeline.SedFusionUseCase;
import org.sedfuse.application.pipeline.SourceFusionProcessor;
import org.sedfuse.application.port.CatalogGateway;
import org.sedfuse.application.port.ClockPort;
import org.sedfuse.application.port.MetricsPort;
import org.sedfuse.application.port.ResultSinkPort;
import org.sedfuse.domain.photometry.BandSurvey;
import org.sedfuse.infrastructure.catalog.SnapshotCatalogGateway;
import org.sedfuse.infrastructure.catalog.ThrottlingCatalogGateway;
import org.sedfuse.infrastructure.persistence.FileResultSinkAdapter;
import org.sedfuse.infrastructure.time.SystemClockAdapter;

/**
 * <strong>What:</strong> Wires the SED fusion use case to its adapters from a {@link FuseConfig}.
 * <p><strong>Why:</strong> Keeps every translation from configuration to concrete adapters in one place so the CLI
 * only deals with flags and exit codes.</p>
 * <p><strong>Role:</strong> Composition root.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build one graph per run.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final FuseConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final InputGrammar grammar;
  private final OutputTemplate template;

  /**
   * Compiles the grammar and template of {@code config}.
   *
   * @param config run configuration
   * @param metrics metrics port shared by every stage
   * @throws IllegalArgumentException when the grammar or template is invalid
   */
  public CompositionRoot(FuseConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  CompositionRoot(FuseConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.grammar = InputGrammar.of(config.fields(), config.fieldPatterns());
    this.template = OutputTemplate.compile(config.template(), grammar.extraFieldNames());
  }

  /**
   * Returns the compiled input grammar.
   *
   * @return grammar
   */
  public InputGrammar grammar() {
    return grammar;
  }

  /**
   * Returns the compiled output template.
   *
   * @return template
   */
  public OutputTemplate template() {
    return template;
  }

  /**
   * Creates the throttled snapshot gateway.
   *
   * @return catalog gateway
   */
  public CatalogGateway catalogGateway() {
    return new ThrottlingCatalogGateway(
        new SnapshotCatalogGateway(config.snapshots()), config.requestDelayMillis(), clock);
  }

  /**
   * Creates one normalizer per catalog.
   *
   * @return normalizers in catalog order
   */
  public List<CatalogNormalizer> normalizers() {
    PositionMatcher matcher = new PositionMatcher(config.toleranceArcsec());
    return List.of(
        new PrimaryPositionNormalizer(),
        new ExtinctionMapNormalizer(config.reddeningColumns()),
        new PrimarySedNormalizer(new SedRowFilter(config.deniedRefcodes())),
        new BandSurveyNormalizer(CatalogId.SURVEY_A, BandSurvey.wise(), matcher),
        new BandSurveyNormalizer(CatalogId.SURVEY_B, BandSurvey.twoMass(), matcher),
        new UvSurveyNormalizer(matcher));
  }

  /**
   * Creates the per-source processor.
   *
   * @param gateway catalog access
   * @return processor
   */
  public SourceFusionProcessor processor(CatalogGateway gateway) {
    PositionMatcher matcher = new PositionMatcher(config.toleranceArcsec());
    return new SourceFusionProcessor(
        gateway,
        normalizers(),
        new BandSurveyNormalizer(CatalogId.SURVEY_B, BandSurvey.twoMassInline(), matcher),
        metrics);
  }

  /**
   * Creates the result sink writing under the configured output directory.
   *
   * @return file sink
   */
  public ResultSinkPort resultSink() {
    return new FileResultSinkAdapter(config.outputDirectory(), config.resultFile());
  }

  /**
   * Builds the full use case graph over the snapshot gateway.
   *
   * @return use case ready to run
   */
  public SedFusionUseCase sedFusionUseCase() {
    return sedFusionUseCase(catalogGateway(), resultSink());
  }

  /**
   * Builds the use case graph over explicit gateway and sink adapters.
   *
   * @param gateway catalog access
   * @param sink result sink
   * @return use case ready to run
   */
  public SedFusionUseCase sedFusionUseCase(CatalogGateway gateway, ResultSinkPort sink) {
    return new SedFusionUseCase(
        new InputLineParser(grammar),
        processor(gateway),
        new ResultAggregator(template),
        sink,
        metrics,
        clock,
        config.plot());
  }
}
