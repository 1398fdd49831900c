package org.sedfuse.application.parse;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.validation.Numbers;

/**
 * <strong>What:</strong> Builds {@link Source} aggregates from parsed input fields.
 * <p><strong>Why:</strong> Centralizes identity resolution (catalog name, then alternate id, then coordinates) and
 * keeps identities unique across one batch.</p>
 * <p><strong>Role:</strong> Application service scoped to one batch run.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; holds the identities issued so far.</p>
 *
 * @since 0.1.0
 */
public final class SourceFactory {
  private final Map<String, Integer> issued = new HashMap<>();

  /**
   * Creates a source for one accepted input line.
   *
   * @param sequenceIndex 1-based ordinal among accepted lines
   * @param fields raw field values produced by {@link InputLineParser}
   * @return new source with a batch-unique identity
   * @throws InvalidSourceLineException when the redshift is present but unparsable or negative
   */
  public Source create(int sequenceIndex, Map<String, String> fields) throws InvalidSourceLineException {
    Objects.requireNonNull(fields, "fields");
    double lat = Numbers.parseOrNaN(fields.get(InputGrammar.LAT));
    double lon = Numbers.parseOrNaN(fields.get(InputGrammar.LON));
    SkyPosition input = new SkyPosition(lat, lon);

    double redshift = Double.NaN;
    String rawRedshift = fields.get(InputGrammar.REDSHIFT);
    if (rawRedshift != null && !rawRedshift.isBlank()) {
      redshift = Numbers.parseOrNaN(rawRedshift);
      if (!Double.isFinite(redshift) || redshift < 0) {
        throw new InvalidSourceLineException("unusable redshift '" + rawRedshift + "'");
      }
    }

    Optional<String> name = nonBlank(fields.get(InputGrammar.NAME));
    Optional<String> alternateId = nonBlank(fields.get(InputGrammar.ALTERNATE_ID));
    String identity = unique(baseIdentity(sequenceIndex, name, alternateId, input));

    Map<String, String> extras = new LinkedHashMap<>();
    fields.forEach((key, value) -> {
      if (!InputGrammar.SEMANTIC_FIELDS.contains(key)) {
        extras.put(key, value);
      }
    });
    return new Source(sequenceIndex, identity, name, alternateId, input, redshift, extras);
  }

  private static String baseIdentity(
      int sequenceIndex, Optional<String> name, Optional<String> alternateId, SkyPosition input) {
    if (name.isPresent()) {
      return name.get();
    }
    if (alternateId.isPresent()) {
      return alternateId.get();
    }
    if (input.isFinite()) {
      return input.toCoordinateString();
    }
    return "unnamed-" + sequenceIndex;
  }

  private String unique(String base) {
    Integer count = issued.merge(base, 1, Integer::sum);
    if (count == 1) {
      return base;
    }
    String candidate = base + "-" + count;
    while (issued.containsKey(candidate)) {
      count = issued.merge(base, 1, Integer::sum);
      candidate = base + "-" + count;
    }
    issued.put(candidate, 1);
    return candidate;
  }

  private static Optional<String> nonBlank(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }
}
