package org.sedfuse.application.catalog;

import java.util.Locale;

/**
 * Catalog queries issued for each source, in the order the fusion pipeline issues them.
 *
 * @since 0.1.0
 */
public enum CatalogId {
  /** Primary catalog position lookup by object name. */
  PRIMARY_POSITION,
  /** Galactic dust map lookup by position, yielding E(B-V). */
  EXTINCTION_MAP,
  /** Primary catalog photometry table by object name. */
  PRIMARY_SED,
  /** Mid-infrared survey cone search. */
  SURVEY_A,
  /** Near-infrared survey cone search. */
  SURVEY_B,
  /** Ultraviolet survey cone search. */
  UV_SURVEY;

  /**
   * Returns the lower-case token used in metric names and snapshot directories.
   *
   * @return token such as {@code survey_a}
   */
  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Indicates whether the catalog is queried by object name rather than by position.
   *
   * @return {@code true} for name-keyed catalogs
   */
  public boolean queriedByName() {
    return this == PRIMARY_POSITION || this == PRIMARY_SED;
  }
}
