package org.sedfuse.infrastructure.catalog;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.RowCatalogTable;

/**
 * Streams a catalog response document into a {@link CatalogTable}.
 *
 * <p>Accepted shapes are {@code {"rows": [ {...}, ... ]}} and a bare array of row objects. Row values must be
 * scalars; other top-level members of the wrapper object are ignored.</p>
 *
 * @since 0.1.0
 */
public final class JsonCatalogTableReader {
  private static final String ROWS_FIELD = "rows";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Reads one response document.
   *
   * @param in JSON input; not closed by this method
   * @return parsed table
   * @throws IOException when the stream cannot be read or is not valid JSON
   * @throws IllegalArgumentException when the document does not have a supported shape
   */
  public CatalogTable read(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    try (JsonParser parser = factory.createParser(in)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      JsonToken token = parser.nextToken();
      if (token == null) {
        return RowCatalogTable.empty();
      }
      List<Map<String, Object>> rows = switch (token) {
        case START_ARRAY -> readRows(parser);
        case START_OBJECT -> readWrapper(parser);
        default -> throw new IllegalArgumentException("Catalog document must be an object or array, found " + token);
      };
      return new RowCatalogTable(rows);
    }
  }

  private List<Map<String, Object>> readWrapper(JsonParser parser) throws IOException {
    List<Map<String, Object>> rows = List.of();
    while (true) {
      JsonToken token = next(parser);
      if (token == JsonToken.END_OBJECT) {
        return rows;
      }
      String field = parser.getCurrentName();
      JsonToken value = next(parser);
      if (ROWS_FIELD.equals(field)) {
        if (value != JsonToken.START_ARRAY) {
          throw new IllegalArgumentException("'rows' must be an array");
        }
        rows = readRows(parser);
      } else {
        parser.skipChildren();
      }
    }
  }

  private List<Map<String, Object>> readRows(JsonParser parser) throws IOException {
    List<Map<String, Object>> rows = new ArrayList<>();
    while (true) {
      JsonToken token = next(parser);
      if (token == JsonToken.END_ARRAY) {
        return rows;
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Catalog rows must be objects, found " + token);
      }
      rows.add(readRow(parser));
    }
  }

  private Map<String, Object> readRow(JsonParser parser) throws IOException {
    Map<String, Object> row = new LinkedHashMap<>();
    while (true) {
      JsonToken token = next(parser);
      if (token == JsonToken.END_OBJECT) {
        return row;
      }
      String column = parser.getCurrentName();
      row.put(column, readScalar(parser, next(parser), column));
    }
  }

  private static Object readScalar(JsonParser parser, JsonToken token, String column) throws IOException {
    return switch (token) {
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Column '" + column + "' must hold a scalar, found " + token);
    };
  }

  private static JsonToken next(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      throw new IOException("Unexpected end of catalog document");
    }
    return token;
  }
}
