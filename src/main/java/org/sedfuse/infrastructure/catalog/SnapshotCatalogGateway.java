package org.sedfuse.infrastructure.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.CatalogUnavailableException;
import org.sedfuse.application.port.CatalogGateway;
import org.sedfuse.domain.sky.SkyPosition;
import org.sedfuse.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CatalogGateway} answering queries from previously fetched responses on disk.
 * <p><strong>Why:</strong> Batch runs are reproducible and testable without network access when every response
 * is a file keyed by catalog and query.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for the catalog port.</p>
 * <p><strong>Layout:</strong> {@code <root>/<catalog token>/<key>.json} where the key is the object name reduced to
 * {@code [A-Za-z0-9._+-]}, or {@code %.5f_%+.5f} of the query position.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable root; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotCatalogGateway implements CatalogGateway {
  private static final Logger log = LoggerFactory.getLogger(SnapshotCatalogGateway.class);
  private static final String EXTENSION = ".json";

  private final Path root;
  private final JsonCatalogTableReader reader;

  public SnapshotCatalogGateway(Path root) {
    this(root, new JsonCatalogTableReader());
  }

  SnapshotCatalogGateway(Path root, JsonCatalogTableReader reader) {
    this.root = Objects.requireNonNull(root, "root");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  @Override
  public Optional<CatalogTable> fetch(CatalogQuery query) throws CatalogUnavailableException {
    Path file = snapshotPath(query);
    if (!Files.isRegularFile(file)) {
      log.debug("No snapshot for {} at {}", query.describe(), file);
      return Optional.empty();
    }
    try (InputStream in = Files.newInputStream(file)) {
      CatalogTable table = reader.read(in);
      log.debug("Loaded {} rows for {} from {}", table.rowCount(), query.describe(), file);
      return Optional.of(table);
    } catch (IOException | IllegalArgumentException ex) {
      throw new CatalogUnavailableException(query.catalog(), "unreadable snapshot " + file + ": " + ex.getMessage(),
          ex);
    }
  }

  /**
   * Resolves the snapshot file answering {@code query}.
   *
   * @param query catalog query
   * @return snapshot path, which may not exist
   */
  public Path snapshotPath(CatalogQuery query) {
    return root.resolve(query.catalog().token()).resolve(key(query) + EXTENSION);
  }

  /**
   * Computes the file key of a query.
   *
   * @param query catalog query
   * @return file name without extension
   */
  public static String key(CatalogQuery query) {
    if (query.objectName().isPresent()) {
      return Strings.toFileToken(query.objectName().get());
    }
    SkyPosition position = query.position();
    return String.format(Locale.ROOT, "%.5f_%+.5f", position.lat(), position.lon());
  }

  public Path root() {
    return root;
  }
}
