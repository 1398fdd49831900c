package org.sedfuse.domain.sed;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.sedfuse.domain.sky.SkyPosition;

/**
 * <strong>What:</strong> One accepted flux-density measurement of a {@link Source} at one frequency.
 * <p><strong>Why:</strong> Gives the aggregator a fixed set of typed fields instead of a free-form attribute
 * bag, so output templates can be validated once before a batch starts.</p>
 * <p><strong>Role:</strong> Domain value object created by catalog normalizers through
 * {@link Source#append(Draft)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param sequenceIndex 1-based ordinal of the owning source within the batch
 * @param positionInSource 1-based position of this measurement within its source
 * @param sourceName identity of the owning source, copied at construction
 * @param redshift redshift of the owning source, copied at construction; may be NaN
 * @param frequencyHz observed frequency in Hz; positive and finite
 * @param fluxDensityJy observed flux density in Jy; positive and finite
 * @param dataSource catalog family that produced the measurement
 * @param position position of the physical detection; may be {@link SkyPosition#UNKNOWN}
 * @param offsetFromReferenceArcsec separation from the source reference position; 0 for the primary catalog
 * @param inputOffsetArcsec separation between the source's primary and input positions; may be NaN
 * @param extinctionFactor multiplicative de-reddening correction; positive and finite
 * @param flag single or averaged marker
 * @param extras caller-defined input fields copied from the source
 * @since 0.1.0
 */
public record Measurement(
    int sequenceIndex,
    int positionInSource,
    String sourceName,
    double redshift,
    double frequencyHz,
    double fluxDensityJy,
    DataSource dataSource,
    SkyPosition position,
    double offsetFromReferenceArcsec,
    double inputOffsetArcsec,
    double extinctionFactor,
    MeasurementFlag flag,
    Map<String, String> extras) {

  /**
   * Validates the measurement invariants.
   *
   * @throws IllegalArgumentException when frequency, flux, or extinction are not positive finite numbers
   */
  public Measurement {
    Objects.requireNonNull(sourceName, "sourceName");
    Objects.requireNonNull(dataSource, "dataSource");
    position = Objects.requireNonNullElse(position, SkyPosition.UNKNOWN);
    flag = Objects.requireNonNullElse(flag, MeasurementFlag.SINGLE);
    // Keeps the input grammar's field order.
    extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    if (positionInSource < 1) {
      throw new IllegalArgumentException("positionInSource must be >= 1 (was " + positionInSource + ")");
    }
    requirePositiveFinite("frequencyHz", frequencyHz);
    requirePositiveFinite("fluxDensityJy", fluxDensityJy);
    requirePositiveFinite("extinctionFactor", extinctionFactor);
  }

  /**
   * Indicates whether {@code value} is usable as a frequency or flux density.
   *
   * @param value candidate value
   * @return {@code true} when positive and finite
   */
  public static boolean isUsable(double value) {
    return Double.isFinite(value) && value > 0;
  }

  private static void requirePositiveFinite(String name, double value) {
    if (!isUsable(value)) {
      throw new IllegalArgumentException(name + " must be positive and finite (was " + value + ")");
    }
  }

  /**
   * Per-measurement values supplied by a normalizer; the owning source supplies everything else.
   *
   * @param frequencyHz observed frequency in Hz
   * @param fluxDensityJy observed flux density in Jy
   * @param dataSource catalog family
   * @param position detection position
   * @param offsetFromReferenceArcsec separation from the source reference position
   * @param extinctionFactor de-reddening factor
   * @param flag single or averaged marker
   */
  public record Draft(
      double frequencyHz,
      double fluxDensityJy,
      DataSource dataSource,
      SkyPosition position,
      double offsetFromReferenceArcsec,
      double extinctionFactor,
      MeasurementFlag flag) {}
}
