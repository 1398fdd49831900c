package org.sedfuse.domain.photometry;

import java.util.Objects;

/**
 * <strong>What:</strong> A magnitude band of a photometric survey with its fixed frequency and zero point.
 * <p><strong>Why:</strong> Converting a catalog magnitude to a flux density needs nothing but these constants,
 * so each survey is described as data instead of dedicated parsing code.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name band label such as {@code W1}
 * @param column catalog column holding the band magnitude
 * @param frequencyHz band frequency in Hz
 * @param zeroPointJy flux density in Jy corresponding to magnitude 0
 * @param noDataMagnitude sentinel magnitude the catalog reports when the band has no measurement
 * @since 0.1.0
 */
public record PhotometricBand(
    String name,
    String column,
    double frequencyHz,
    double zeroPointJy,
    double noDataMagnitude) {

  /** Sentinel used by the survey tables when a band was not measured. */
  public static final double DEFAULT_NO_DATA_MAGNITUDE = -999.0;

  public PhotometricBand {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(column, "column");
    if (!(frequencyHz > 0) || !(zeroPointJy > 0)) {
      throw new IllegalArgumentException("band " + name + " needs positive frequency and zero point");
    }
  }

  /**
   * Creates a band using {@link #DEFAULT_NO_DATA_MAGNITUDE}.
   *
   * @param name band label
   * @param column magnitude column
   * @param frequencyHz band frequency in Hz
   * @param zeroPointJy zero-point flux density in Jy
   * @return band descriptor
   */
  public static PhotometricBand of(String name, String column, double frequencyHz, double zeroPointJy) {
    return new PhotometricBand(name, column, frequencyHz, zeroPointJy, DEFAULT_NO_DATA_MAGNITUDE);
  }

  /**
   * Converts a magnitude in this band to a flux density.
   *
   * @param magnitude catalog magnitude
   * @return {@code zeroPointJy * 10^(-0.4 * magnitude)} in Jy
   */
  public double fluxDensityJy(double magnitude) {
    return zeroPointJy * Math.pow(10.0, -0.4 * magnitude);
  }

  /**
   * Indicates whether {@code magnitude} is the catalog's "no data" sentinel.
   *
   * @param magnitude catalog magnitude
   * @return {@code true} when the band carries no measurement
   */
  public boolean isNoData(double magnitude) {
    return Double.compare(magnitude, noDataMagnitude) == 0;
  }

  /**
   * Returns a copy reading its magnitude from a different column.
   *
   * @param otherColumn replacement column name
   * @return band with the same constants bound to {@code otherColumn}
   */
  public PhotometricBand withColumn(String otherColumn) {
    return new PhotometricBand(name, otherColumn, frequencyHz, zeroPointJy, noDataMagnitude);
  }
}
