package org.sedfuse.domain.photometry;

import java.util.List;
import java.util.Objects;
import org.sedfuse.domain.sed.DataSource;

/**
 * <strong>What:</strong> Band table of a magnitude survey together with the columns holding detection positions.
 * <p><strong>Why:</strong> SURVEY_A and SURVEY_B differ only in their bands, so one normalizer consumes either
 * description.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param dataSource catalog family the measurements are attributed to
 * @param latColumn column holding the detection's first coordinate
 * @param lonColumn column holding the detection's second coordinate
 * @param bands bands in output order
 * @since 0.1.0
 */
public record BandSurvey(DataSource dataSource, String latColumn, String lonColumn, List<PhotometricBand> bands) {

  public BandSurvey {
    Objects.requireNonNull(dataSource, "dataSource");
    Objects.requireNonNull(latColumn, "latColumn");
    Objects.requireNonNull(lonColumn, "lonColumn");
    bands = List.copyOf(Objects.requireNonNull(bands, "bands"));
    if (bands.isEmpty()) {
      throw new IllegalArgumentException("survey " + dataSource + " needs at least one band");
    }
  }

  /**
   * WISE all-sky 4-band mid-infrared survey (profile-fit magnitudes W1-W4).
   *
   * @return SURVEY_A band table
   */
  public static BandSurvey wise() {
    return new BandSurvey(DataSource.SURVEY_A, "ra", "dec", List.of(
        PhotometricBand.of("W1", "w1mpro", 8.856e13, 306.682),
        PhotometricBand.of("W2", "w2mpro", 6.445e13, 170.663),
        PhotometricBand.of("W3", "w3mpro", 2.675e13, 29.045),
        PhotometricBand.of("W4", "w4mpro", 1.346e13, 8.284)));
  }

  /**
   * 2MASS point-source catalog J/H/Ks magnitudes as served by its own query.
   *
   * @return SURVEY_B band table
   */
  public static BandSurvey twoMass() {
    return new BandSurvey(DataSource.SURVEY_B, "ra", "dec", List.of(
        PhotometricBand.of("J", "j_m", 2.429e14, 1594.0),
        PhotometricBand.of("H", "h_m", 1.805e14, 1024.0),
        PhotometricBand.of("Ks", "k_m", 1.390e14, 667.0)));
  }

  /**
   * 2MASS magnitudes carried inline by a WISE row ({@code j_m_2mass} and friends).
   *
   * @return SURVEY_B band table reading the inline columns
   */
  public static BandSurvey twoMassInline() {
    BandSurvey standalone = twoMass();
    return new BandSurvey(DataSource.SURVEY_B, standalone.latColumn(), standalone.lonColumn(),
        standalone.bands().stream().map(band -> band.withColumn(band.column() + "_2mass")).toList());
  }
}
