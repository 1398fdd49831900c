package org.sedfuse.application.pipeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.application.output.PlotTable;
import org.sedfuse.application.output.ResultAggregator;
import org.sedfuse.application.parse.InputLineParser;
import org.sedfuse.application.parse.InvalidSourceLineException;
import org.sedfuse.application.parse.SourceFactory;
import org.sedfuse.application.port.ClockPort;
import org.sedfuse.application.port.MetricsPort;
import org.sedfuse.application.port.ResultSinkPort;
import org.sedfuse.domain.sed.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Batch use case turning an input file of sources into SED result lines and plot tables.
 * <p><strong>Why:</strong> One malformed line or misbehaving source must not cost the rest of the batch; every
 * per-source problem is logged and counted while the batch continues.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the parser, {@link SourceFusionProcessor},
 * {@link ResultAggregator} and the {@link ResultSinkPort}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run once per batch.</p>
 * <p><strong>Observability:</strong> Emits {@code sed.lines.*}, {@code sed.sources.*},
 * {@code sed.measurements.written} and {@code sed.source.latencyMillis}; puts the source identity in the
 * {@value #MDC_SOURCE} MDC key while a source is processed.</p>
 *
 * @since 0.1.0
 */
public final class SedFusionUseCase {
  private static final Logger log = LoggerFactory.getLogger(SedFusionUseCase.class);

  /** MDC key carrying the identity of the source being processed. */
  public static final String MDC_SOURCE = "source";

  private final InputLineParser parser;
  private final SourceFusionProcessor processor;
  private final ResultAggregator aggregator;
  private final ResultSinkPort sink;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final boolean writePlots;

  public SedFusionUseCase(
      InputLineParser parser,
      SourceFusionProcessor processor,
      ResultAggregator aggregator,
      ResultSinkPort sink,
      MetricsPort metrics,
      ClockPort clock,
      boolean writePlots) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.writePlots = writePlots;
  }

  /**
   * Processes every line of {@code input}.
   *
   * @param input UTF-8 input file
   * @return batch counters
   * @throws IOException when the input cannot be read or results cannot be written
   */
  public BatchSummary run(Path input) throws IOException {
    log.info("SED fusion reading sources from {}", input);
    try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
      return run(reader);
    }
  }

  /**
   * Processes every line of {@code reader}; closes the result sink when done.
   *
   * @param reader input lines
   * @return batch counters
   * @throws IOException when reading or writing fails
   */
  public BatchSummary run(BufferedReader reader) throws IOException {
    SourceFactory factory = new SourceFactory();
    long linesRead = 0;
    long skipped = 0;
    long processed = 0;
    long failed = 0;
    long written = 0;
    int accepted = 0;
    try (ResultSinkPort out = this.sink) {
      while (true) {
        // The flag stays set so the caller can report the interrupt.
        if (Thread.currentThread().isInterrupted()) {
          log.warn("Interrupted after {} lines; remaining sources not processed", linesRead);
          break;
        }
        String line = reader.readLine();
        if (line == null) {
          break;
        }
        linesRead++;
        if (InputLineParser.isIgnorable(line)) {
          continue;
        }
        Optional<Map<String, String>> fields = parser.parse(line);
        if (fields.isEmpty()) {
          log.warn("Line {} does not match the input grammar; skipped", linesRead);
          metrics.increment("sed.lines.skipped");
          skipped++;
          continue;
        }
        Source source;
        try {
          source = factory.create(accepted + 1, fields.get());
        } catch (InvalidSourceLineException ex) {
          log.warn("Line {} skipped: {}", linesRead, ex.getMessage());
          metrics.increment("sed.lines.skipped");
          skipped++;
          continue;
        }
        accepted++;
        metrics.increment("sed.lines.parsed");
        int count = processSource(source, out);
        if (count < 0) {
          failed++;
        } else {
          processed++;
          written += count;
        }
      }
    }
    BatchSummary summary = new BatchSummary(linesRead, skipped, processed, failed, written);
    log.info("SED fusion finished: {} sources written, {} failed, {} lines skipped, {} measurements",
        processed, failed, skipped, written);
    return summary;
  }

  /**
   * Runs one source through every catalog and writes its results.
   *
   * @return number of measurements written, or -1 when the source failed
   */
  private int processSource(Source source, ResultSinkPort out) throws IOException {
    String previous = MDC.get(MDC_SOURCE);
    MDC.put(MDC_SOURCE, source.identity());
    long started = clock.nowMillis();
    try {
      List<String> lines;
      Optional<PlotTable> plot;
      try {
        processor.process(source);
        lines = aggregator.render(source);
        plot = writePlots ? aggregator.plot(source) : Optional.empty();
      } catch (RuntimeException ex) {
        log.error("Source {} (line ordinal {}) failed; continuing with next source",
            source.identity(), source.sequenceIndex(), ex);
        metrics.increment("sed.sources.failed");
        return -1;
      }
      out.writeLines(lines);
      if (plot.isPresent()) {
        out.writePlot(source.identity(), plot.get());
      }
      for (int i = 0; i < lines.size(); i++) {
        metrics.increment("sed.measurements.written");
      }
      metrics.increment("sed.sources.processed");
      log.info("Source {} produced {} measurements", source.identity(), lines.size());
      return lines.size();
    } finally {
      metrics.observe("sed.source.latencyMillis", clock.nowMillis() - started);
      if (previous == null) {
        MDC.remove(MDC_SOURCE);
      } else {
        MDC.put(MDC_SOURCE, previous);
      }
    }
  }
}
