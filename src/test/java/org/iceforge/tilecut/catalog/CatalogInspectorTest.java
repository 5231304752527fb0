package org.iceforge.tilecut.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogInspectorTest {

    @TempDir
    Path tmp;

    private final CatalogInspector inspector = new CatalogInspector(new CatalogReader());

    private Path csv(String name, String content) throws Exception {
        return Files.writeString(tmp.resolve(name), content);
    }

    @Test
    void cleanCatalog_isValidWithItsFootprint() throws Exception {
        Path p = csv("ok.csv", "TARGETID,RA,DEC\nA,150.0,2.0\nB,150.5,-1.5\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 100);

        assertTrue(r.valid());
        assertEquals("RA", r.raColumn());
        assertEquals("TARGETID", r.idColumn());
        assertEquals(2, r.validPositions());
        assertEquals(150.0, r.raMin());
        assertEquals(150.5, r.raMax());
        assertEquals(-1.5, r.decMin());
        assertThat(r.errors()).isEmpty();
        assertThat(r.warnings()).isEmpty();
    }

    @Test
    void rowsWithoutPositions_areCountedAndWarnedAbout() throws Exception {
        Path p = csv("gaps.csv", "RA,DEC\n150.0,2.0\n,2.1\nabc,2.2\n150.3,2.3\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 100);

        assertTrue(r.valid());
        assertEquals(2, r.validPositions());
        assertEquals(2, r.invalidPositions());
        assertThat(r.warnings()).anyMatch(w -> w.contains("2 of 4 rows have no usable position"));
    }

    @Test
    void outOfRangeCoordinates_areWarnedAbout() throws Exception {
        Path p = csv("range.csv", "RA,DEC\n370.0,2.0\n10.0,-95.0\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 100);

        assertTrue(r.valid());
        assertThat(r.warnings()).anyMatch(w -> w.startsWith("RA outside"));
        assertThat(r.warnings()).anyMatch(w -> w.startsWith("Dec outside"));
    }

    @Test
    void missingPositionColumn_isInvalid() throws Exception {
        Path p = csv("nora.csv", "NAME,DEC\nA,2.0\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 100);

        assertFalse(r.valid());
        assertNull(r.raColumn());
        assertThat(r.errors()).anyMatch(e -> e.contains("No RA column"));
        assertThat(r.columns()).containsExactly("NAME", "DEC");
    }

    @Test
    void explicitColumnNames_areHonoured() throws Exception {
        Path p = csv("custom.csv", "ALPHA,DELTA\n150.0,2.0\n");

        CatalogReport r = inspector.inspect(p, "ALPHA", "DELTA", null, 100);

        assertTrue(r.valid());
        assertEquals("ALPHA", r.raColumn());
        assertEquals("DELTA", r.decColumn());
    }

    @Test
    void catalogOverTheRowCap_isInvalid() throws Exception {
        Path p = csv("big.csv", "RA,DEC\n1,1\n2,2\n3,3\n4,4\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 3);

        assertFalse(r.valid());
        assertEquals(4, r.totalRows());
        assertThat(r.errors()).containsExactly("Catalog has 4 rows, more than the limit of 3");
    }

    @Test
    void noUsablePosition_isInvalid() throws Exception {
        Path p = csv("blank.csv", "RA,DEC\nx,y\n");

        CatalogReport r = inspector.inspect(p, null, null, null, 100);

        assertFalse(r.valid());
        assertNull(r.raMin());
        assertThat(r.errors()).anyMatch(e -> e.startsWith("No row has a usable position"));
    }
}
