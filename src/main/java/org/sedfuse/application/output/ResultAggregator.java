package org.sedfuse.application.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.domain.physics.Cosmology;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.Source;

/**
 * <strong>What:</strong> Serializes a source's measurements into result lines and a rest-frame plot table.
 * <p><strong>Why:</strong> The result file keeps observed values while plots need luminosities, so both views are
 * derived here from the same measurement list.</p>
 * <p><strong>Role:</strong> Application service invoked once per source after all normalizers ran.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ResultAggregator {
  private final OutputTemplate template;
  private final Cosmology cosmology;

  public ResultAggregator(OutputTemplate template) {
    this(template, Cosmology.standard());
  }

  public ResultAggregator(OutputTemplate template, Cosmology cosmology) {
    this.template = Objects.requireNonNull(template, "template");
    this.cosmology = Objects.requireNonNull(cosmology, "cosmology");
  }

  /**
   * Renders one line per measurement in append order.
   *
   * @param source source whose measurements are rendered
   * @return rendered lines
   */
  public List<String> render(Source source) {
    List<String> lines = new ArrayList<>(source.measurements().size());
    for (Measurement measurement : source.measurements()) {
      lines.add(template.render(measurement));
    }
    return lines;
  }

  /**
   * Builds the rest-frame luminosity table.
   *
   * @param source source to plot
   * @return plot table, or empty when the redshift is unknown or there are no measurements
   */
  public Optional<PlotTable> plot(Source source) {
    double z = source.redshift();
    if (!Double.isFinite(z) || source.measurements().isEmpty()) {
      return Optional.empty();
    }
    List<PlotTable.Row> rows = new ArrayList<>(source.measurements().size());
    for (Measurement measurement : source.measurements()) {
      rows.add(PlotTable.Row.of(
          cosmology.restFrequency(z, measurement.frequencyHz()),
          measurement.dataSource(),
          cosmology.luminosity(z, measurement.fluxDensityJy(), measurement.extinctionFactor())));
    }
    return Optional.of(new PlotTable(rows));
  }

  public OutputTemplate template() {
    return template;
  }
}
