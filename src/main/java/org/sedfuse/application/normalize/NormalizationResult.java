package org.sedfuse.application.normalize;

import java.util.Objects;
import java.util.Optional;
import org.sedfuse.application.catalog.CatalogId;

/**
 * Outcome of applying one catalog response to a source.
 *
 * @param catalog catalog that was normalized
 * @param accepted number of measurements appended (or fields resolved)
 * @param failure reason the catalog contributed nothing usable; empty on success
 * @since 0.1.0
 */
public record NormalizationResult(CatalogId catalog, int accepted, Optional<String> failure) {

  public NormalizationResult {
    Objects.requireNonNull(catalog, "catalog");
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    if (accepted < 0) {
      throw new IllegalArgumentException("accepted must be >= 0");
    }
  }

  public static NormalizationResult accepted(CatalogId catalog, int accepted) {
    return new NormalizationResult(catalog, accepted, Optional.empty());
  }

  public static NormalizationResult softFailure(CatalogId catalog, String reason) {
    return new NormalizationResult(catalog, 0, Optional.of(reason));
  }

  /**
   * Indicates whether the catalog contributed nothing usable.
   *
   * @return {@code true} on a soft failure
   */
  public boolean isSoftFailure() {
    return failure.isPresent();
  }
}
