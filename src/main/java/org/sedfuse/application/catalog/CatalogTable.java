package org.sedfuse.application.catalog;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * <strong>What:</strong> Read-only tabular response returned by one catalog query.
 * <p><strong>Why:</strong> Normalizers must tell an absent column or row apart from a zero-valued cell and must
 * never crash on either; every accessor therefore answers with an empty optional instead of throwing.</p>
 * <p><strong>Role:</strong> Contract between the catalog gateway adapters and the catalog normalizers.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public interface CatalogTable {

  /**
   * Returns the number of rows.
   *
   * @return row count; zero for an empty response
   */
  int rowCount();

  /**
   * Returns the column names present in the response.
   *
   * @return column names in response order
   */
  Set<String> columns();

  /**
   * Returns the raw value of one cell.
   *
   * @param row zero-based row index
   * @param column column name
   * @return cell value; empty when the row or column is absent or the cell is {@code null}
   */
  Optional<Object> cell(int row, String column);

  /**
   * Indicates whether the response carries {@code column}.
   *
   * @param column column name
   * @return {@code true} when present
   */
  default boolean hasColumn(String column) {
    return column != null && columns().contains(column);
  }

  /**
   * Indicates whether the response has no rows.
   *
   * @return {@code true} when empty
   */
  default boolean isEmpty() {
    return rowCount() == 0;
  }

  /**
   * Reads a numeric cell. Numbers and numeric strings are accepted; blanks and other text are treated as
   * absent.
   *
   * @param row zero-based row index
   * @param column column name
   * @return numeric value, or empty when absent or not numeric
   */
  default OptionalDouble number(int row, String column) {
    Optional<Object> value = cell(row, column);
    if (value.isEmpty()) {
      return OptionalDouble.empty();
    }
    Object raw = value.get();
    if (raw instanceof Number n) {
      return OptionalDouble.of(n.doubleValue());
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(text));
    } catch (NumberFormatException ex) {
      return OptionalDouble.empty();
    }
  }

  /**
   * Reads a cell as text.
   *
   * @param row zero-based row index
   * @param column column name
   * @return textual value, or empty when absent
   */
  default Optional<String> text(int row, String column) {
    return cell(row, column).map(Object::toString);
  }

  /**
   * Reads the single value of a one-row response.
   *
   * @param column column name
   * @return numeric value of row 0, or empty when the table is empty or the column is absent
   */
  default OptionalDouble scalarNumber(String column) {
    return isEmpty() ? OptionalDouble.empty() : number(0, column);
  }
}
