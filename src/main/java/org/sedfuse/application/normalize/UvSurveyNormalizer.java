package org.sedfuse.application.normalize;

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
import org.sedfuse.domain.sky.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Averages UV survey detections into at most one measurement per band.
 * <p><strong>Why:</strong> The UV survey often lists several visits of the same object; each band keeps the
 * unweighted mean position, flux and local reddening of the detections that survive filtering.</p>
 * <p><strong>Role:</strong> Catalog normalizer for {@link CatalogId#UV_SURVEY}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @implNote Fluxes are reported in microjansky and converted to Jy. The averaged flag is set whenever the
 *     response held more than one row, before any filtering.
 * @since 0.1.0
 */
public final class UvSurveyNormalizer implements CatalogNormalizer {
  private static final Logger log = LoggerFactory.getLogger(UvSurveyNormalizer.class);

  public static final String LAT_COLUMN = "ra";
  public static final String LON_COLUMN = "dec";
  public static final String REDDENING_COLUMN = "e_bv";

  /** Far- and near-UV bands. */
  public static final List<UvBand> BANDS = List.of(
      new UvBand("FUV", "fuv_flux", 1.9627e15),
      new UvBand("NUV", "nuv_flux", 1.3202e15));

  private static final double MICROJANSKY = 1e-6;

  private final PositionMatcher matcher;

  public UvSurveyNormalizer(PositionMatcher matcher) {
    this.matcher = Objects.requireNonNull(matcher, "matcher");
  }

  @Override
  public CatalogId catalog() {
    return CatalogId.UV_SURVEY;
  }

  @Override
  public NormalizationResult normalize(Source source, CatalogTable table) {
    SkyPosition reference = source.searchPosition();
    if (!reference.isFinite()) {
      return NormalizationResult.softFailure(catalog(), "no search position");
    }
    if (table.isEmpty()) {
      return NormalizationResult.softFailure(catalog(), "empty response");
    }
    MeasurementFlag flag = table.rowCount() > 1 ? MeasurementFlag.AVERAGED : MeasurementFlag.SINGLE;
    int accepted = 0;
    for (UvBand band : BANDS) {
      Optional<Detection> mean = average(table, band, reference);
      if (mean.isEmpty()) {
        log.debug("{} band {} has no usable detection", catalog().token(), band.name());
        continue;
      }
      Detection detection = mean.get();
      source.append(new Measurement.Draft(
          band.frequencyHz(),
          detection.fluxMicroJy() * MICROJANSKY,
          DataSource.UV_SURVEY,
          detection.position(),
          detection.position().offsetArcsec(reference),
          ExtinctionLaw.correctionFactor(detection.reddening(), band.frequencyHz()),
          flag));
      accepted++;
    }
    if (accepted == 0) {
      return NormalizationResult.softFailure(catalog(), "no usable detection in any band");
    }
    return NormalizationResult.accepted(catalog(), accepted);
  }

  private Optional<Detection> average(CatalogTable table, UvBand band, SkyPosition reference) {
    double sumLat = 0;
    double sumLon = 0;
    double sumFlux = 0;
    double sumReddening = 0;
    int count = 0;
    for (int row = 0; row < table.rowCount(); row++) {
      Optional<SkyPosition> position = PositionMatcher.rowPosition(table, row, LAT_COLUMN, LON_COLUMN);
      if (position.isEmpty() || !matcher.accepts(position.get().offsetArcsec(reference))) {
        continue;
      }
      OptionalDouble flux = table.number(row, band.column());
      OptionalDouble reddening = table.number(row, REDDENING_COLUMN);
      if (flux.isEmpty() || !Measurement.isUsable(flux.getAsDouble())
          || reddening.isEmpty() || !Measurement.isUsable(reddening.getAsDouble())) {
        continue;
      }
      sumLat += position.get().lat();
      sumLon += position.get().lon();
      sumFlux += flux.getAsDouble();
      sumReddening += reddening.getAsDouble();
      count++;
    }
    if (count == 0) {
      return Optional.empty();
    }
    return Optional.of(new Detection(
        new SkyPosition(sumLat / count, sumLon / count), sumFlux / count, sumReddening / count));
  }

  /**
   * One UV band.
   *
   * @param name band label
   * @param column flux column in microjansky
   * @param frequencyHz band frequency in Hz
   */
  public record UvBand(String name, String column, double frequencyHz) {}

  private record Detection(SkyPosition position, double fluxMicroJy, double reddening) {}
}
