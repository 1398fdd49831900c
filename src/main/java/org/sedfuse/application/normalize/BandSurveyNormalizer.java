package org.sedfuse.application.normalize;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.photometry.BandSurvey;
import org.sedfuse.domain.photometry.PhotometricBand;
import org.sedfuse.domain.physics.ExtinctionLaw;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.MeasurementFlag;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts magnitude-survey rows into one measurement per band.
 * <p><strong>Why:</strong> The mid-IR and near-IR surveys differ only in their band tables, so both run through
 * this class with a different {@link BandSurvey}.</p>
 * <p><strong>Role:</strong> Catalog normalizer for {@link CatalogId#SURVEY_A} and {@link CatalogId#SURVEY_B},
 * including SURVEY_B bands carried inline by a SURVEY_A response.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop rows without a position or farther than the matching radius from the search position.</li>
 *   <li>Drop bands reporting the no-data sentinel, a non-numeric magnitude, or an unusable flux.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class BandSurveyNormalizer implements CatalogNormalizer {
  private static final Logger log = LoggerFactory.getLogger(BandSurveyNormalizer.class);

  private final CatalogId catalog;
  private final BandSurvey survey;
  private final PositionMatcher matcher;

  public BandSurveyNormalizer(CatalogId catalog, BandSurvey survey, PositionMatcher matcher) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.survey = Objects.requireNonNull(survey, "survey");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
  }

  @Override
  public CatalogId catalog() {
    return catalog;
  }

  public BandSurvey survey() {
    return survey;
  }

  /**
   * Indicates whether {@code table} holds a numeric value for every band of this survey on some row.
   *
   * <p>The pipeline uses this on SURVEY_A responses to decide whether SURVEY_B must be queried separately.</p>
   *
   * @param table catalog response
   * @return {@code true} when all band columns are populated on at least one row
   */
  public boolean carriesBands(CatalogTable table) {
    for (int row = 0; row < table.rowCount(); row++) {
      boolean complete = true;
      for (PhotometricBand band : survey.bands()) {
        if (table.number(row, band.column()).isEmpty()) {
          complete = false;
          break;
        }
      }
      if (complete) {
        return true;
      }
    }
    return false;
  }

  @Override
  public NormalizationResult normalize(Source source, CatalogTable table) {
    SkyPosition reference = source.searchPosition();
    if (!reference.isFinite()) {
      return NormalizationResult.softFailure(catalog, "no search position");
    }
    if (table.isEmpty()) {
      return NormalizationResult.softFailure(catalog, "empty response");
    }
    int accepted = 0;
    for (int row = 0; row < table.rowCount(); row++) {
      Optional<SkyPosition> position =
          PositionMatcher.rowPosition(table, row, survey.latColumn(), survey.lonColumn());
      if (position.isEmpty()) {
        log.debug("{} row {} rejected: no position", catalog.token(), row);
        continue;
      }
      double offset = position.get().offsetArcsec(reference);
      if (!matcher.accepts(offset)) {
        log.debug("{} row {} rejected: offset {} arcsec", catalog.token(), row, offset);
        continue;
      }
      for (PhotometricBand band : survey.bands()) {
        if (appendBand(source, table, row, band, position.get(), offset)) {
          accepted++;
        }
      }
    }
    if (accepted == 0) {
      return NormalizationResult.softFailure(catalog, "no usable band within " + matcher.toleranceArcsec()
          + " arcsec");
    }
    return NormalizationResult.accepted(catalog, accepted);
  }

  private boolean appendBand(
      Source source, CatalogTable table, int row, PhotometricBand band, SkyPosition position, double offset) {
    OptionalDouble magnitude = table.number(row, band.column());
    if (magnitude.isEmpty() || band.isNoData(magnitude.getAsDouble())) {
      return false;
    }
    double flux = band.fluxDensityJy(magnitude.getAsDouble());
    if (!Measurement.isUsable(flux)) {
      return false;
    }
    source.append(new Measurement.Draft(
        band.frequencyHz(),
        flux,
        survey.dataSource(),
        position,
        offset,
        ExtinctionLaw.correctionFactor(source.reddening(), band.frequencyHz()),
        MeasurementFlag.SINGLE));
    return true;
  }
}
