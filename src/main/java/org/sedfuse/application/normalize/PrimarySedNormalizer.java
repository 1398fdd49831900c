package org.sedfuse.application.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.physics.ExtinctionLaw;
import org.sedfuse.domain.sed.DataSource;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.MeasurementFlag;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns the primary catalog's photometry table into PRIMARY measurements.
 * <p><strong>Why:</strong> The table mixes total fluxes with line fluxes, model values and aperture photometry;
 * only rows passing {@link SedRowFilter} and carrying positive finite frequency and flux are kept.</p>
 * <p><strong>Role:</strong> Catalog normalizer for {@link CatalogId#PRIMARY_SED}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its immutable filter.</p>
 *
 * @since 0.1.0
 */
public final class PrimarySedNormalizer implements CatalogNormalizer {
  private static final Logger log = LoggerFactory.getLogger(PrimarySedNormalizer.class);

  public static final String FREQUENCY = "Frequency";
  public static final String FLUX = "Photometry Measurement";
  public static final String FLUX_FALLBACK = "NED Photometry Measurement";
  public static final String REFCODE = "Refcode";
  public static final String QUALIFIERS = "Qualifiers";
  public static final String COMMENTS = "Comments";
  public static final String PASSBAND = "Observed Passband";

  private static final List<String> FREE_TEXT = List.of(REFCODE, QUALIFIERS, COMMENTS, PASSBAND);
  private static final int LOG_TEXT_LIMIT = 80;

  private final SedRowFilter filter;

  public PrimarySedNormalizer() {
    this(new SedRowFilter());
  }

  public PrimarySedNormalizer(SedRowFilter filter) {
    this.filter = Objects.requireNonNull(filter, "filter");
  }

  @Override
  public CatalogId catalog() {
    return CatalogId.PRIMARY_SED;
  }

  @Override
  public NormalizationResult normalize(Source source, CatalogTable table) {
    if (table.isEmpty()) {
      return NormalizationResult.softFailure(catalog(), "empty response");
    }
    String fluxColumn = table.hasColumn(FLUX) ? FLUX : FLUX_FALLBACK;
    if (!table.hasColumn(FREQUENCY) || !table.hasColumn(fluxColumn)) {
      return NormalizationResult.softFailure(catalog(), "frequency or flux column missing");
    }
    int accepted = 0;
    for (int row = 0; row < table.rowCount(); row++) {
      List<String> freeText = new ArrayList<>(FREE_TEXT.size());
      for (String column : FREE_TEXT) {
        table.text(row, column).ifPresent(freeText::add);
      }
      Optional<String> passband = table.text(row, PASSBAND);
      Optional<String> rejection = filter.rejection(freeText, passband);
      if (rejection.isPresent()) {
        if (log.isDebugEnabled()) {
          log.debug("Row {} rejected: {} [{}]", row, rejection.get(), Logs.truncate(String.join(" | ", freeText),
              LOG_TEXT_LIMIT));
        }
        continue;
      }
      OptionalDouble frequency = table.number(row, FREQUENCY);
      OptionalDouble flux = table.number(row, fluxColumn);
      if (frequency.isEmpty() || flux.isEmpty()
          || !Measurement.isUsable(frequency.getAsDouble()) || !Measurement.isUsable(flux.getAsDouble())) {
        log.debug("Row {} rejected: unusable frequency or flux", row);
        continue;
      }
      double frequencyHz = frequency.getAsDouble();
      source.append(new Measurement.Draft(
          frequencyHz,
          flux.getAsDouble(),
          DataSource.PRIMARY,
          source.primaryPosition(),
          0.0,
          ExtinctionLaw.correctionFactor(source.reddening(), frequencyHz),
          MeasurementFlag.SINGLE));
      accepted++;
    }
    if (accepted == 0) {
      return NormalizationResult.softFailure(catalog(), "all " + table.rowCount() + " rows filtered");
    }
    return NormalizationResult.accepted(catalog(), accepted);
  }
}
