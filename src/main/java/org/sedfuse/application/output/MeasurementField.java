package org.sedfuse.application.output;

import java.util.Optional;
import java.util.function.Function;
import org.sedfuse.domain.sed.Measurement;

/**
 * Measurement values addressable from an output template.
 *
 * @since 0.1.0
 */
public enum MeasurementField {
  INDEX("index", Measurement::sequenceIndex, 1),
  NAME("name", m -> m.sourceName().replaceAll("\\s+", ""), "name"),
  REDSHIFT("z", Measurement::redshift, 0.5),
  NUM("num", Measurement::positionInSource, 1),
  FREQ("freq", Measurement::frequencyHz, 1.0e14),
  FLUX("flux", Measurement::fluxDensityJy, 1.0e-3),
  SOURCE("source", m -> m.dataSource().label(), "NED"),
  FLAG("flag", m -> m.flag().symbol(), 'a'),
  LAT("lat", m -> m.position().lat(), 1.0),
  LON("lon", m -> m.position().lon(), 1.0),
  OFFSET("offset", Measurement::offsetFromReferenceArcsec, 1.0),
  INPUT_OFFSET("input_offset", Measurement::inputOffsetArcsec, 1.0),
  EXTINCTION("extinction", Measurement::extinctionFactor, 1.0);

  private final String key;
  private final Function<Measurement, Object> accessor;
  private final Object sample;

  MeasurementField(String key, Function<Measurement, Object> accessor, Object sample) {
    this.key = key;
    this.accessor = accessor;
    this.sample = sample;
  }

  /**
   * Returns the placeholder name of the field.
   *
   * @return template key such as {@code freq}
   */
  public String key() {
    return key;
  }

  Object valueOf(Measurement measurement) {
    return accessor.apply(measurement);
  }

  Object sample() {
    return sample;
  }

  /**
   * Looks up a field by placeholder name.
   *
   * @param key template key
   * @return matching field, or empty for extras and unknown names
   */
  public static Optional<MeasurementField> byKey(String key) {
    for (MeasurementField field : values()) {
      if (field.key.equals(key)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}
