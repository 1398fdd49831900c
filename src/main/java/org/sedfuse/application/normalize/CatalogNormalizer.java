package org.sedfuse.application.normalize;

import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.domain.sed.Source;

/**
 * <strong>What:</strong> Converts one catalog response into state on a {@link Source}.
 * <p><strong>Why:</strong> Every catalog has its own columns, units and quality rules; the pipeline drives them all
 * through one contract.</p>
 * <p><strong>Role:</strong> Application strategy; implementations append measurements or resolve source fields.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Never throw for missing columns, empty tables, or rows that are all filtered out.</li>
 *   <li>Report those conditions as a soft failure in the returned {@link NormalizationResult}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless; the source passed in is confined to the caller.</p>
 *
 * @since 0.1.0
 */
public interface CatalogNormalizer {
  /**
   * Returns the catalog whose responses this normalizer understands.
   *
   * @return catalog id
   */
  CatalogId catalog();

  /**
   * Applies one response to {@code source}.
   *
   * @param source source being reconciled; mutated in place
   * @param table catalog response
   * @return number of accepted entries and, when nothing was accepted, the reason
   */
  NormalizationResult normalize(Source source, CatalogTable table);
}
