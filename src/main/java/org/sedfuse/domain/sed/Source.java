package org.sedfuse.domain.sed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.domain.sky.SkyPosition;

/**
 * <strong>What:</strong> One astronomical object being reconciled across catalogs.
 * <p><strong>Why:</strong> Collects the identity, positions, redshift, reddening, and the ordered list of
 * accepted measurements that together form one SED record.</p>
 * <p><strong>Role:</strong> Mutable domain aggregate owned by a single per-source pipeline run; only catalog
 * normalizers mutate it, each at most once and in catalog order.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the search position used for every cross-match.</li>
 *   <li>Copy source-level values into each appended {@link Measurement}.</li>
 *   <li>Keep measurement positions contiguous ({@code 1..N}) in append order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to the thread processing the source.</p>
 *
 * @since 0.1.0
 */
public final class Source {
  private final int sequenceIndex;
  private final String identity;
  private final Optional<String> catalogName;
  private final Optional<String> alternateId;
  private final SkyPosition inputPosition;
  private final double redshift;
  private final Map<String, String> extras;
  private final List<Measurement> measurements = new ArrayList<>();

  private SkyPosition primaryPosition = SkyPosition.UNKNOWN;
  private double inputOffsetArcsec = Double.NaN;
  private double reddening = Double.NaN;

  /**
   * Creates a source from parsed input fields.
   *
   * @param sequenceIndex 1-based ordinal of the source in the batch
   * @param identity unique record identity; must be non-blank
   * @param catalogName object name used for primary-catalog lookups, if supplied
   * @param alternateId alternate identifier used when the name lookup fails, if supplied
   * @param inputPosition caller-supplied position; {@link SkyPosition#UNKNOWN} when absent
   * @param redshift non-negative redshift, or NaN when not supplied
   * @param extras caller-defined extra input fields in grammar order
   * @throws IllegalArgumentException if the identity is blank or the redshift is negative
   */
  public Source(
      int sequenceIndex,
      String identity,
      Optional<String> catalogName,
      Optional<String> alternateId,
      SkyPosition inputPosition,
      double redshift,
      Map<String, String> extras) {
    if (identity == null || identity.isBlank()) {
      throw new IllegalArgumentException("identity must not be blank");
    }
    if (redshift < 0) {
      throw new IllegalArgumentException("redshift must be non-negative (was " + redshift + ")");
    }
    this.sequenceIndex = sequenceIndex;
    this.identity = identity;
    this.catalogName = Objects.requireNonNullElse(catalogName, Optional.empty());
    this.alternateId = Objects.requireNonNullElse(alternateId, Optional.empty());
    this.inputPosition = Objects.requireNonNullElse(inputPosition, SkyPosition.UNKNOWN);
    this.redshift = redshift;
    this.extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  public int sequenceIndex() {
    return sequenceIndex;
  }

  public String identity() {
    return identity;
  }

  public Optional<String> catalogName() {
    return catalogName;
  }

  public Optional<String> alternateId() {
    return alternateId;
  }

  public SkyPosition inputPosition() {
    return inputPosition;
  }

  public SkyPosition primaryPosition() {
    return primaryPosition;
  }

  public double redshift() {
    return redshift;
  }

  public double reddening() {
    return reddening;
  }

  public double inputOffsetArcsec() {
    return inputOffsetArcsec;
  }

  public Map<String, String> extras() {
    return extras;
  }

  /**
   * Returns the position used for all cross-matching.
   *
   * @return primary-catalog position when resolved, otherwise the input position (possibly not finite)
   */
  public SkyPosition searchPosition() {
    return primaryPosition.isFinite() ? primaryPosition : inputPosition;
  }

  /**
   * Records the position resolved from the primary catalog and its offset from the input position.
   *
   * @param position resolved position; must be finite
   * @throws IllegalArgumentException if {@code position} is not finite
   */
  public void resolvePrimaryPosition(SkyPosition position) {
    if (position == null || !position.isFinite()) {
      throw new IllegalArgumentException("primary position must be finite");
    }
    this.primaryPosition = position;
    this.inputOffsetArcsec = position.offsetArcsec(inputPosition);
  }

  /**
   * Records the line-of-sight colour excess E(B-V).
   *
   * @param value reddening value; must be finite and non-negative
   * @throws IllegalArgumentException if {@code value} is negative or not finite
   */
  public void resolveReddening(double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException("reddening must be finite and non-negative (was " + value + ")");
    }
    this.reddening = value;
  }

  /**
   * Appends a measurement, copying source-level fields into it.
   *
   * @param draft per-measurement values; must not be {@code null}
   * @return the appended measurement
   * @throws IllegalArgumentException when the draft violates {@link Measurement} invariants
   */
  public Measurement append(Measurement.Draft draft) {
    Objects.requireNonNull(draft, "draft");
    Measurement measurement = new Measurement(
        sequenceIndex,
        measurements.size() + 1,
        identity,
        redshift,
        draft.frequencyHz(),
        draft.fluxDensityJy(),
        draft.dataSource(),
        draft.position(),
        draft.offsetFromReferenceArcsec(),
        inputOffsetArcsec,
        draft.extinctionFactor(),
        draft.flag(),
        extras);
    measurements.add(measurement);
    return measurement;
  }

  /**
   * Returns the accepted measurements in discovery order.
   *
   * @return unmodifiable view of the measurements
   */
  public List<Measurement> measurements() {
    return Collections.unmodifiableList(measurements);
  }

  @Override
  public String toString() {
    return "Source[" + sequenceIndex + ", " + identity + "]";
  }
}
