package org.sedfuse.application.catalog;

/**
 * Signals that a catalog could not answer a query (missing snapshot, unreadable response, remote failure).
 *
 * <p>The fusion pipeline treats this as a soft failure of one catalog for one source.</p>
 *
 * @since 0.1.0
 */
public class CatalogUnavailableException extends Exception {
  private static final long serialVersionUID = 1L;

  private final CatalogId catalog;

  public CatalogUnavailableException(CatalogId catalog, String message) {
    super(message);
    this.catalog = catalog;
  }

  public CatalogUnavailableException(CatalogId catalog, String message, Throwable cause) {
    super(message, cause);
    this.catalog = catalog;
  }

  /**
   * Returns the catalog that failed.
   *
   * @return failing catalog
   */
  public CatalogId catalog() {
    return catalog;
  }
}
