package org.sedfuse.application.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.domain.sed.DataSource;

/**
 * Rest-frame luminosity table of one source, one row per measurement with the luminosity placed in the column of
 * its data source.
 *
 * @since 0.1.0
 */
public final class PlotTable {
  /** First header column; the remaining ones are the {@link DataSource} names. */
  public static final String FREQUENCY_HEADER = "rest_frequency";

  private final List<Row> rows;

  public PlotTable(List<Row> rows) {
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  public List<Row> rows() {
    return rows;
  }

  /**
   * Returns the header line.
   *
   * @return space-separated column names
   */
  public static String header() {
    StringBuilder header = new StringBuilder(FREQUENCY_HEADER);
    for (DataSource source : DataSource.values()) {
      header.append(' ').append(source.name());
    }
    return header.toString();
  }

  /**
   * Fits a power law to the rows inside the UV window, summing the luminosity columns of each row.
   *
   * @return fit, or empty when too few rows qualify
   */
  public Optional<PowerLawFit> uvFit() {
    double[] frequencies = new double[rows.size()];
    double[] luminosities = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      frequencies[i] = rows.get(i).restFrequencyHz();
      luminosities[i] = rows.get(i).totalLuminosity();
    }
    return PowerLawFit.fit(frequencies, luminosities);
  }

  /**
   * Renders the table: header, optional fit comment, then one line per row.
   *
   * @return lines without terminators
   */
  public List<String> lines() {
    List<String> lines = new ArrayList<>(rows.size() + 2);
    lines.add(header());
    uvFit().ifPresent(fit -> lines.add(String.format(Locale.ROOT, "# uv_fit slope=%.6e intercept=%.6e points=%d",
        fit.slope(), fit.intercept(), fit.points())));
    for (Row row : rows) {
      StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "%.6e", row.restFrequencyHz()));
      for (double value : row.luminosities()) {
        line.append(' ').append(String.format(Locale.ROOT, "%.6e", value));
      }
      lines.add(line.toString());
    }
    return Collections.unmodifiableList(lines);
  }

  /**
   * One plot row.
   *
   * @param restFrequencyHz rest-frame frequency in Hz
   * @param luminosities luminosity per {@link DataSource} ordinal; zero for the other sources
   */
  public record Row(double restFrequencyHz, double[] luminosities) {
    public Row {
      Objects.requireNonNull(luminosities, "luminosities");
      if (luminosities.length != DataSource.values().length) {
        throw new IllegalArgumentException("expected one luminosity per data source");
      }
      luminosities = luminosities.clone();
    }

    /**
     * Builds a row with a single non-zero column.
     *
     * @param restFrequencyHz rest-frame frequency
     * @param source data source owning the luminosity
     * @param luminosity luminosity in W/Hz
     * @return row
     */
    public static Row of(double restFrequencyHz, DataSource source, double luminosity) {
      double[] values = new double[DataSource.values().length];
      values[source.ordinal()] = luminosity;
      return new Row(restFrequencyHz, values);
    }

    @Override
    public double[] luminosities() {
      return luminosities.clone();
    }

    /**
     * Returns the luminosity of one data source.
     *
     * @param source data source
     * @return luminosity in W/Hz; zero for other sources
     */
    public double luminosity(DataSource source) {
      return luminosities[source.ordinal()];
    }

    double totalLuminosity() {
      double total = 0;
      for (double value : luminosities) {
        total += value;
      }
      return total;
    }
  }
}
