package org.sedfuse.infrastructure.persistence;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.sedfuse.application.output.PlotTable;
import org.sedfuse.application.port.ResultSinkPort;
import org.sedfuse.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes result lines to one file and each plot table to {@code <out>/plots/<identity>.dat}.
 *
 * <p>The result file is truncated when the first line is written, or on close when nothing was written. Identities
 * that reduce to the same file name get a numeric suffix.</p>
 *
 * @since 0.1.0
 */
public final class FileResultSinkAdapter implements ResultSinkPort {
  private static final Logger log = LoggerFactory.getLogger(FileResultSinkAdapter.class);

  /** Sub-directory holding plot tables. */
  public static final String PLOT_DIRECTORY = "plots";
  private static final String PLOT_EXTENSION = ".dat";

  private final Path outputDirectory;
  private final Path resultFile;
  private final Set<String> plotNames = new HashSet<>();
  private BufferedWriter writer;
  private long linesWritten;

  public FileResultSinkAdapter(Path outputDirectory, String resultFileName) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    String name = Strings.requireNonBlank("resultFile", resultFileName);
    this.resultFile = outputDirectory.resolve(name);
  }

  @Override
  public void writeLines(List<String> lines) throws IOException {
    Objects.requireNonNull(lines, "lines");
    BufferedWriter out = writer();
    for (String line : lines) {
      out.write(line);
      out.newLine();
      linesWritten++;
    }
  }

  @Override
  public void writePlot(String identity, PlotTable table) throws IOException {
    Objects.requireNonNull(table, "table");
    Path plots = outputDirectory.resolve(PLOT_DIRECTORY);
    Files.createDirectories(plots);
    Path file = plots.resolve(uniquePlotName(identity) + PLOT_EXTENSION);
    Files.write(file, table.lines(), StandardCharsets.UTF_8);
    log.debug("Wrote plot table {}", file);
  }

  @Override
  public void close() throws IOException {
    if (writer == null) {
      writer();
    }
    writer.close();
    log.info("Wrote {} result lines to {}", linesWritten, resultFile);
  }

  public Path resultFile() {
    return resultFile;
  }

  private BufferedWriter writer() throws IOException {
    if (writer == null) {
      Files.createDirectories(outputDirectory);
      writer = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8);
    }
    return writer;
  }

  private String uniquePlotName(String identity) {
    String base = Strings.toFileToken(Strings.requireNonBlank("identity", identity));
    String candidate = base;
    int suffix = 2;
    while (!plotNames.add(candidate)) {
      candidate = base + "-" + suffix++;
    }
    return candidate;
  }
}
