package org.sedfuse.application.port;

import java.io.IOException;
import java.util.List;
import org.sedfuse.application.output.PlotTable;

/**
 * <strong>What:</strong> Destination for rendered SED result lines and per-source plot tables.
 * <p><strong>Why:</strong> Separates the aggregation of measurements from the files they end up in.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code FileResultSinkAdapter} and test doubles.</p>
 * <p><strong>Thread-safety:</strong> Used from the single batch thread.</p>
 *
 * @since 0.1.0
 */
public interface ResultSinkPort extends AutoCloseable {
  /**
   * Appends the rendered lines of one source to the result stream.
   *
   * @param lines rendered lines in measurement order
   * @throws IOException when writing fails
   */
  void writeLines(List<String> lines) throws IOException;

  /**
   * Writes the plot table of one source.
   *
   * @param identity unique identity of the source
   * @param table plot rows
   * @throws IOException when writing fails
   */
  void writePlot(String identity, PlotTable table) throws IOException;

  /**
   * Flushes and releases underlying resources.
   *
   * @throws IOException when flushing fails
   */
  @Override
  void close() throws IOException;
}
