package org.sedfuse.application.normalize;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.sed.Source;

/**
 * Resolves a source's line-of-sight colour excess E(B-V) from a dust map response.
 *
 * <p>The first configured column present with a finite non-negative value wins.</p>
 *
 * @since 0.1.0
 */
public final class ExtinctionMapNormalizer implements CatalogNormalizer {
  /** Columns tried when none are configured. */
  public static final List<String> DEFAULT_COLUMNS = List.of("ebv_sandf_mean", "E(B-V)");

  private final List<String> columns;

  public ExtinctionMapNormalizer() {
    this(DEFAULT_COLUMNS);
  }

  public ExtinctionMapNormalizer(List<String> columns) {
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (this.columns.isEmpty()) {
      throw new IllegalArgumentException("at least one reddening column is required");
    }
  }

  public List<String> columns() {
    return columns;
  }

  @Override
  public CatalogId catalog() {
    return CatalogId.EXTINCTION_MAP;
  }

  @Override
  public NormalizationResult normalize(Source source, CatalogTable table) {
    if (table.isEmpty()) {
      return NormalizationResult.softFailure(catalog(), "empty response");
    }
    for (String column : columns) {
      OptionalDouble value = table.scalarNumber(column);
      if (value.isPresent() && Double.isFinite(value.getAsDouble()) && value.getAsDouble() >= 0) {
        source.resolveReddening(value.getAsDouble());
        return NormalizationResult.accepted(catalog(), 1);
      }
    }
    return NormalizationResult.softFailure(catalog(), "no usable reddening in " + columns);
  }
}
