package org.sedfuse.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.sedfuse.application.catalog.CatalogTable;

class JsonCatalogTableReaderTest {
  private final JsonCatalogTableReader reader = new JsonCatalogTableReader();

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void readsWrappedRowsAndIgnoresOtherMembers() throws IOException {
    CatalogTable table = reader.read(json("""
        {"query": {"ra": 1.0}, "rows": [
          {"ra": 150.1, "dec": -2, "w1mpro": "15.2", "flag": true, "note": null},
          {"ra": 150.2, "extra": "x"}
        ], "source": "archive"}
        """));

    assertEquals(2, table.rowCount());
    assertEquals(Set.of("ra", "dec", "w1mpro", "flag", "note", "extra"), table.columns());
    assertEquals(-2.0, table.number(0, "dec").getAsDouble());
    assertEquals(15.2, table.number(0, "w1mpro").getAsDouble());
    assertEquals(Optional.of(Boolean.TRUE), table.cell(0, "flag"));
    assertEquals(Optional.empty(), table.cell(0, "note"));
    assertTrue(table.number(1, "dec").isEmpty());
  }

  @Test
  void readsBareArrayAndEmptyDocument() throws IOException {
    assertEquals(1, reader.read(json("[{\"E(B-V)\": 0.03}]")).rowCount());
    assertTrue(reader.read(json("")).isEmpty());
    assertTrue(reader.read(json("{\"rows\": []}")).isEmpty());
  }

  @Test
  void rejectsUnsupportedShapes() {
    assertThrows(IllegalArgumentException.class, () -> reader.read(json("42")));
    assertThrows(IllegalArgumentException.class, () -> reader.read(json("{\"rows\": {}}")));
    assertThrows(IllegalArgumentException.class, () -> reader.read(json("[1, 2]")));
    assertThrows(IllegalArgumentException.class, () -> reader.read(json("[{\"ra\": [1, 2]}]")));
  }

  @Test
  void truncatedDocumentIsIoError() {
    assertThrows(IOException.class, () -> reader.read(json("{\"rows\": [{\"ra\": 1")));
  }
}
