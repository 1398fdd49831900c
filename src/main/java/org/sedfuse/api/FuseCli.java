package org.sedfuse.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.sedfuse.application.pipeline.BatchSummary;
import org.sedfuse.application.pipeline.SedFusionUseCase;
import org.sedfuse.config.CompositionRoot;
import org.sedfuse.config.ConfigMerger;
import org.sedfuse.config.DefaultsForMode;
import org.sedfuse.config.FuseConfig;
import org.sedfuse.infrastructure.metrics.NoOpMetricsAdapter;
import org.sedfuse.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.sedfuse.logging.LoggingConfigurator;
import org.sedfuse.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the batch SED fusion run.
 *
 * @since 0.1.0
 */
public final class FuseCli {
  private static final Logger log = LoggerFactory.getLogger(FuseCli.class);
  private static final String MODE = "fuse";
  private static final Set<String> SUPPORTED_FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: fuse in=PATH [snapshots=DIR] [out=DIR] [resultFile=NAME] [template=TEXT] "
          + "[fields=a,b,...] [field.NAME.pattern=REGEX] [plot=true|false] [requestDelayMillis=MS] "
          + "[toleranceArcsec=ARCSEC] [config=YAML] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      sedfuse fuse: build per-source SEDs

      Usage:
        fuse in=sources.txt snapshots=./snapshots out=./sed-out [options]

      Required:
        in=PATH                    Source list, one source per line ('#' starts a comment)

      Optional:
        snapshots=DIR              Stored catalog responses, <catalog>/<key>.json (default ./snapshots)
        out=DIR                    Output directory (default ./sedfuse-out)
        resultFile=NAME            Result file name inside out (default sed.dat)
        template=TEXT              Output line template, {field} or {field:%fmt} placeholders
        fields=a,b,...             Input fields in line order (default lat,lon,name,z,id,rm,rm_err)
        field.NAME.pattern=REGEX   Override the pattern of one input field
        plot=true|false            Write per-source plot tables under out/plots (default true)
        requestDelayMillis=MS      Minimum delay between catalog requests, 0-60000 (default 1000)
        toleranceArcsec=ARCSEC     Cross-match radius (default 10)
        sed.deniedRefcodes=a,b     Reference codes dropped from the primary photometry
        reddeningColumns=a,b       Dust map columns tried in order
        config=PATH                YAML file with common/fuse sections; CLI values win
        --dry-run                  Validate configuration and print the plan without processing
        --allow-overwrite          Permit writing into a non-empty output directory
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private FuseCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the fuse command and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for fuse CLI");
    }
    List<String> unsupported = input.unsupportedFlags(SUPPORTED_FLAGS);
    if (!unsupported.isEmpty()) {
      log.error("Unsupported flags: {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig;
    try {
      yamlConfig = ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), MODE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    FuseConfig config;
    String metricsExporter;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = FuseConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fuse arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    ValidatedPaths paths;
    try {
      paths = validatePaths(config, allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fuse path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CompositionRoot root;
      try {
        root = new CompositionRoot(config, new NoOpMetricsAdapter());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid grammar or template: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      printDryRunPlan(config, root, paths, allowOverwrite, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      SedFusionUseCase useCase = root.sedFusionUseCase();
      log.info("Configured fuse run: input={}, snapshots={}, output={}, metricsExporter={}",
          paths.input(), paths.snapshots(), paths.output(), metricsExporter);
      BatchSummary summary = useCase.run(paths.input());
      if (Thread.currentThread().isInterrupted()) {
        log.error("Fuse run interrupted; results are incomplete");
        return ExitCode.INTERRUPTED;
      }
      CliPrinter.println(String.format(
          "sedfuse: %d sources written, %d failed, %d lines skipped, %d measurements -> %s",
          summary.sourcesProcessed(), summary.sourcesFailed(), summary.linesSkipped(),
          summary.measurementsWritten(), paths.output().resolve(config.resultFile())));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Fuse configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Fuse I/O failure while processing {}", paths.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in fuse run", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ValidatedPaths validatePaths(FuseConfig config, boolean allowOverwrite, boolean createIfMissing) {
    Path input = Paths.requireReadableFile("in", config.input());
    Path snapshots = Paths.requireReadableDir("snapshots", config.snapshots());
    Path output = Paths.validateWritableDir(config.outputDirectory(), createIfMissing, allowOverwrite);
    return new ValidatedPaths(input, snapshots, output);
  }

  private static void printDryRunPlan(
      FuseConfig config, CompositionRoot root, ValidatedPaths paths, boolean allowOverwrite, String exporter) {
    CliPrinter.printLines(
        "Fuse dry-run: no catalogs will be read and no files written.",
        " Source list        : " + paths.input(),
        " Catalog snapshots  : " + paths.snapshots(),
        " Output directory   : " + paths.output(),
        " Result file        : " + config.resultFile(),
        " Plot tables        : " + (config.plot() ? config.plotDirectory() : "<disabled>"),
        " Input fields       : " + String.join(" ", root.grammar().fieldNames()),
        " Output fields      : " + String.join(" ", root.template().fieldNames()),
        " Tolerance (arcsec) : " + config.toleranceArcsec(),
        " Request delay (ms) : " + config.requestDelayMillis(),
        " Denied refcodes    : " + String.join(",", config.deniedRefcodes()),
        " Reddening columns  : " + String.join(",", config.reddeningColumns()),
        " Metrics exporter   : " + exporter,
        " Allow overwrite    : " + allowOverwrite,
        " Re-run without --dry-run to process sources.");
  }

  private record ValidatedPaths(Path input, Path snapshots, Path output) {}
}
