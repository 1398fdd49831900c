package org.sedfuse.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.CatalogUnavailableException;
import org.sedfuse.domain.sky.SkyPosition;

class SnapshotCatalogGatewayTest {

  @Test
  void keysByNameOrPosition() {
    assertEquals("3C_273", SnapshotCatalogGateway.key(CatalogQuery.byName(CatalogId.PRIMARY_SED, "3C 273")));
    assertEquals("187.27792_+2.05239", SnapshotCatalogGateway.key(
        CatalogQuery.byPosition(CatalogId.SURVEY_A, new SkyPosition(187.277921, 2.052388))));
    assertEquals("10.00000_-0.50000", SnapshotCatalogGateway.key(
        CatalogQuery.byPosition(CatalogId.UV_SURVEY, new SkyPosition(10, -0.5))));
  }

  @Test
  void loadsSnapshotFromCatalogDirectory(@TempDir Path root) throws Exception {
    Path dir = Files.createDirectories(root.resolve("primary_position"));
    Files.writeString(dir.resolve("NGC1068.json"),
        "{\"rows\": [{\"pos_ra_equ_J2000_d\": 40.66963, \"pos_dec_equ_J2000_d\": -0.01329}]}",
        StandardCharsets.UTF_8);
    SnapshotCatalogGateway gateway = new SnapshotCatalogGateway(root);

    CatalogTable table = gateway.fetch(CatalogQuery.byName(CatalogId.PRIMARY_POSITION, "NGC1068")).orElseThrow();

    assertEquals(40.66963, table.scalarNumber("pos_ra_equ_J2000_d").getAsDouble());
    assertEquals(dir.resolve("NGC1068.json"),
        gateway.snapshotPath(CatalogQuery.byName(CatalogId.PRIMARY_POSITION, "NGC1068")));
  }

  @Test
  void missingSnapshotIsEmpty(@TempDir Path root) throws CatalogUnavailableException {
    assertTrue(new SnapshotCatalogGateway(root)
        .fetch(CatalogQuery.byName(CatalogId.PRIMARY_SED, "nothing")).isEmpty());
  }

  @Test
  void unreadableSnapshotMakesCatalogUnavailable(@TempDir Path root) throws IOException {
    Path dir = Files.createDirectories(root.resolve("survey_a"));
    Files.writeString(dir.resolve("1.00000_+1.00000.json"), "\"not a table\"", StandardCharsets.UTF_8);
    SnapshotCatalogGateway gateway = new SnapshotCatalogGateway(root);

    CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
        () -> gateway.fetch(CatalogQuery.byPosition(CatalogId.SURVEY_A, new SkyPosition(1, 1))));
    assertEquals(CatalogId.SURVEY_A, ex.catalog());
    assertTrue(ex.getMessage().startsWith("unreadable snapshot"));
  }
}
