package org.sedfuse.application.port;

import java.util.Optional;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.CatalogUnavailableException;

/**
 * <strong>What:</strong> Port through which the fusion pipeline obtains catalog responses.
 * <p><strong>Why:</strong> Keeps the per-source control flow independent of how responses are retrieved
 * (snapshots on disk, remote services, in-memory test doubles).</p>
 * <p><strong>Role:</strong> Application port implemented by infrastructure catalog adapters.</p>
 * <p><strong>Thread-safety:</strong> The batch pipeline calls it from a single thread; implementations need not be
 * thread-safe unless documented.</p>
 *
 * @since 0.1.0
 */
public interface CatalogGateway {
  /**
   * Fetches the response to one query.
   *
   * @param query catalog query; never {@code null}
   * @return the response table, or empty when the catalog has no entry for the query
   * @throws CatalogUnavailableException when the catalog could not be consulted
   */
  Optional<CatalogTable> fetch(CatalogQuery query) throws CatalogUnavailableException;
}
