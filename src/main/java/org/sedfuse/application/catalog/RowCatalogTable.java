package org.sedfuse.application.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CatalogTable} backed by a list of row maps.
 *
 * <p>The column set is the union of the keys of every row, so a column that only some rows populate is still
 * reported as present; the missing cells read as absent.</p>
 *
 * @since 0.1.0
 */
public final class RowCatalogTable implements CatalogTable {
  private static final RowCatalogTable EMPTY = new RowCatalogTable(List.of());

  private final List<Map<String, Object>> rows;
  private final Set<String> columns;

  /**
   * Creates a table from row maps.
   *
   * @param rows rows in response order; values may be {@code null}
   */
  public RowCatalogTable(List<? extends Map<String, ?>> rows) {
    Objects.requireNonNull(rows, "rows");
    List<Map<String, Object>> copy = new ArrayList<>(rows.size());
    Set<String> names = new LinkedHashSet<>();
    for (Map<String, ?> row : rows) {
      Map<String, Object> rowCopy = new LinkedHashMap<>();
      if (row != null) {
        rowCopy.putAll(row);
      }
      names.addAll(rowCopy.keySet());
      copy.add(Collections.unmodifiableMap(rowCopy));
    }
    this.rows = List.copyOf(copy);
    this.columns = Collections.unmodifiableSet(names);
  }

  /**
   * Returns a table with no rows and no columns.
   *
   * @return shared empty table
   */
  public static RowCatalogTable empty() {
    return EMPTY;
  }

  /**
   * Convenience factory for tests and adapters.
   *
   * @param rows row maps
   * @return table over {@code rows}
   */
  @SafeVarargs
  public static RowCatalogTable of(Map<String, ?>... rows) {
    return new RowCatalogTable(List.of(rows));
  }

  @Override
  public int rowCount() {
    return rows.size();
  }

  @Override
  public Set<String> columns() {
    return columns;
  }

  @Override
  public Optional<Object> cell(int row, String column) {
    if (row < 0 || row >= rows.size() || column == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rows.get(row).get(column));
  }

  @Override
  public String toString() {
    return "RowCatalogTable[rows=" + rows.size() + ", columns=" + columns + "]";
  }
}
