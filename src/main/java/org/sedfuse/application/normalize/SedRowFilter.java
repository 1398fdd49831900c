package org.sedfuse.application.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Quality filter for primary catalog photometry rows.
 *
 * <p>A row is rejected when any free-text field marks it as a spectral line, a model value, a count-statistics
 * estimate, or comes from a denied reference code; or when its observed passband names an instrument or aperture
 * whose values are not comparable to total fluxes. SDSS passbands are accepted unless they are PSF magnitudes.</p>
 *
 * @since 0.1.0
 */
public final class SedRowFilter {
  /** Reference codes rejected when none are configured. */
  public static final List<String> DEFAULT_DENIED_REFCODES = List.of("1995ApJS..101..117D");

  private static final Pattern LINE_WORD = Pattern.compile("\\bline\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern MODEL = Pattern.compile("model", Pattern.CASE_INSENSITIVE);
  private static final Pattern COUNT_STATISTICS = Pattern.compile("count\\s+statistics", Pattern.CASE_INSENSITIVE);
  private static final Pattern PASSBAND_DENIED =
      Pattern.compile("HST|PSF|Petrosian|Kron|isophotal|aperture|fiber", Pattern.CASE_INSENSITIVE);
  private static final Pattern PSF = Pattern.compile("PSF", Pattern.CASE_INSENSITIVE);
  private static final String SDSS_MARKER = "(SDSS";

  private final List<String> deniedRefcodes;

  public SedRowFilter() {
    this(DEFAULT_DENIED_REFCODES);
  }

  public SedRowFilter(List<String> deniedRefcodes) {
    Objects.requireNonNull(deniedRefcodes, "deniedRefcodes");
    List<String> normalized = new ArrayList<>();
    for (String refcode : deniedRefcodes) {
      if (refcode != null && !refcode.isBlank()) {
        normalized.add(refcode.trim().toLowerCase(Locale.ROOT));
      }
    }
    this.deniedRefcodes = List.copyOf(normalized);
  }

  public List<String> deniedRefcodes() {
    return deniedRefcodes;
  }

  /**
   * Returns the reason a row is rejected, if any.
   *
   * @param freeText reference code, qualifiers, comments, and passband values present on the row
   * @param passband observed passband, if present
   * @return rejection reason, or empty when the row is acceptable
   */
  public Optional<String> rejection(List<String> freeText, Optional<String> passband) {
    for (String text : freeText) {
      if (text == null || text.isEmpty()) {
        continue;
      }
      if (LINE_WORD.matcher(text).find()) {
        return Optional.of("line entry");
      }
      if (MODEL.matcher(text).find()) {
        return Optional.of("model value");
      }
      if (COUNT_STATISTICS.matcher(text).find()) {
        return Optional.of("count statistics");
      }
      String lower = text.toLowerCase(Locale.ROOT);
      for (String refcode : deniedRefcodes) {
        if (lower.contains(refcode)) {
          return Optional.of("denied refcode " + refcode);
        }
      }
    }
    if (passband.isPresent() && passbandDenied(passband.get())) {
      return Optional.of("passband " + passband.get());
    }
    return Optional.empty();
  }

  static boolean passbandDenied(String passband) {
    boolean psf = PSF.matcher(passband).find();
    if (passband.contains(SDSS_MARKER) && !psf) {
      return false;
    }
    return PASSBAND_DENIED.matcher(passband).find();
  }
}
