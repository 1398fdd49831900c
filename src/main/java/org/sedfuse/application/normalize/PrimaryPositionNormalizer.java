package org.sedfuse.application.normalize;

import java.util.OptionalDouble;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a source's primary catalog position from a name lookup response.
 *
 * @since 0.1.0
 */
public final class PrimaryPositionNormalizer implements CatalogNormalizer {
  private static final Logger log = LoggerFactory.getLogger(PrimaryPositionNormalizer.class);

  /** J2000 right ascension column in decimal degrees. */
  public static final String LAT_COLUMN = "pos_ra_equ_J2000_d";
  /** J2000 declination column in decimal degrees. */
  public static final String LON_COLUMN = "pos_dec_equ_J2000_d";

  @Override
  public CatalogId catalog() {
    return CatalogId.PRIMARY_POSITION;
  }

  @Override
  public NormalizationResult normalize(Source source, CatalogTable table) {
    if (table.isEmpty()) {
      return NormalizationResult.softFailure(catalog(), "empty response");
    }
    OptionalDouble lat = table.scalarNumber(LAT_COLUMN);
    OptionalDouble lon = table.scalarNumber(LON_COLUMN);
    if (lat.isEmpty() || lon.isEmpty()) {
      return NormalizationResult.softFailure(catalog(), "position columns missing");
    }
    SkyPosition position = new SkyPosition(lat.getAsDouble(), lon.getAsDouble());
    if (!position.isFinite()) {
      return NormalizationResult.softFailure(catalog(), "position not finite");
    }
    source.resolvePrimaryPosition(position);
    log.debug("Primary position {} ({} arcsec from input)", position, source.inputOffsetArcsec());
    return NormalizationResult.accepted(catalog(), 1);
  }
}
