package org.sedfuse.application.catalog;

import java.util.Objects;
import java.util.Optional;
import org.sedfuse.domain.sky.SkyPosition;

/**
 * One request against a catalog: either by object name or by sky position.
 *
 * @param catalog catalog being queried
 * @param objectName object name for name-keyed catalogs; empty for cone searches
 * @param position search position for cone searches; {@link SkyPosition#UNKNOWN} for name lookups
 * @since 0.1.0
 */
public record CatalogQuery(CatalogId catalog, Optional<String> objectName, SkyPosition position) {

  public CatalogQuery {
    Objects.requireNonNull(catalog, "catalog");
    objectName = Objects.requireNonNullElse(objectName, Optional.empty());
    position = Objects.requireNonNullElse(position, SkyPosition.UNKNOWN);
  }

  /**
   * Builds a name lookup.
   *
   * @param catalog name-keyed catalog
   * @param name object name; must not be blank
   * @return query keyed by {@code name}
   */
  public static CatalogQuery byName(CatalogId catalog, String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return new CatalogQuery(catalog, Optional.of(name.trim()), SkyPosition.UNKNOWN);
  }

  /**
   * Builds a cone search around {@code position}.
   *
   * @param catalog position-keyed catalog
   * @param position finite search position
   * @return query keyed by {@code position}
   */
  public static CatalogQuery byPosition(CatalogId catalog, SkyPosition position) {
    if (position == null || !position.isFinite()) {
      throw new IllegalArgumentException("position must be finite");
    }
    return new CatalogQuery(catalog, Optional.empty(), position);
  }

  /**
   * Short human-readable description for logs.
   *
   * @return catalog token followed by the name or position
   */
  public String describe() {
    return catalog.token() + "(" + objectName.orElseGet(position::toCoordinateString) + ")";
  }
}
