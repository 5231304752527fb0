package org.iceforge.tilecut.output;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import nom.tam.fits.TableHDU;
import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.batch.SourceRequest;
import org.iceforge.tilecut.extract.CutoutArtifact;
import org.iceforge.tilecut.extract.WindowSize;
import org.iceforge.tilecut.fits.FitsSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CutoutContainerWriterTest {

    @TempDir
    Path tmp;

    private final CutoutContainerWriter writer = new CutoutContainerWriter();

    private static CutoutArtifact plane(String instrument, String band, double value) {
        Map<String, Object> transform = new LinkedHashMap<>();
        transform.put("CTYPE1", "RA---TAN");
        transform.put("CRPIX1", 2.0);
        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("XMIN", 10);
        provenance.put("XPIX", Double.NaN);
        return CutoutArtifact.success(new double[][]{{value, value}, {value, value}}, transform, provenance)
                .withSource(instrument, band);
    }

    private static SourceRequest request(String id) {
        return request(0, id);
    }

    private static SourceRequest request(int rowIndex, String id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("OBJECT_ID", id);
        row.put("RA", "150.25");
        row.put("FLUX", 12.5);
        row.put("NOTE", "");
        return new SourceRequest(rowIndex, id, 150.25, 2.5, WindowSize.square(2), List.of(), List.of(),
                List.of(ProductType.BGSUB), row);
    }

    @Test
    void write_layoutAndHeaders() throws Exception {
        Path out = writer.write(tmp, request("obj/1"), ProductType.BGSUB,
                List.of(plane("VIS", "VIS", 1.0), plane("NISP", "NIR-H", 2.0)), true);

        assertEquals(tmp.resolve("BGSUB").resolve("obj_1.fits"), out);
        try (Fits fits = new Fits(out.toFile())) {
            Header primary = fits.getHDU(0).getHeader();
            assertEquals("obj/1", primary.getStringValue("OBJID"));
            assertEquals("VIS_VIS", primary.getStringValue("HDU1"));
            assertEquals("NISP_NIR-H", primary.getStringValue("HDU2"));
            assertEquals(3, primary.getIntValue("SRCTABLE"));
            assertEquals("BGSUB", primary.getStringValue("PRODTYPE"));

            BasicHDU<?> second = fits.getHDU(2);
            assertEquals("NISP_NIR-H", second.getHeader().getStringValue("EXTNAME"));
            assertEquals("NIR-H", second.getHeader().getStringValue("BAND"));
            assertEquals(10, second.getHeader().getIntValue("XMIN"));
            assertFalse(second.getHeader().containsKey("XPIX"));
            assertEquals(2.0, FitsSupport.readImage(second)[1][1]);

            TableHDU<?> table = (TableHDU<?>) fits.getHDU(3);
            assertEquals(1, table.getNRows());
            assertThat(FitsSupport.findColumn(table, "FLUX")).contains(2);
            assertEquals(12.5, FitsSupport.readColumn(table, 2)[0]);
            assertEquals(150.25, FitsSupport.readColumn(table, 1)[0]);
        }
    }

    @Test
    void write_withoutRow_hasOnlyImagePlanes() throws Exception {
        Path out = writer.write(tmp, request("S1"), ProductType.CATALOG_PSF, List.of(plane("VIS", "VIS", 1.0)), false);

        assertTrue(out.endsWith(Path.of("CATALOG-PSF", "S1.fits")));
        try (Fits fits = new Fits(out.toFile())) {
            assertFalse(fits.getHDU(0).getHeader().containsKey("SRCTABLE"));
            assertNull(fits.getHDU(2));
        }
    }

    @Test
    void duplicateTargetIds_getDistinctContainers() throws Exception {
        Path first = writer.write(tmp, request(0, "S1"), ProductType.BGSUB, List.of(plane("VIS", "VIS", 1.0)), false);
        Path second = writer.write(tmp, request(4, "S1"), ProductType.BGSUB, List.of(plane("VIS", "VIS", 2.0)), false);

        assertEquals(tmp.resolve("BGSUB").resolve("S1.fits"), first);
        assertEquals(tmp.resolve("BGSUB").resolve("S1_row4.fits"), second);
        try (Fits fits = new Fits(first.toFile())) {
            assertEquals(1.0, FitsSupport.readImage(fits.getHDU(1))[0][0]);
        }
        try (Fits fits = new Fits(second.toFile())) {
            assertEquals(2.0, FitsSupport.readImage(fits.getHDU(1))[0][0]);
        }
    }

    @Test
    void fileName_isSanitised() {
        assertEquals("a_b_c.fits", CutoutContainerWriter.fileName("a b/c"));
        assertThat(CutoutContainerWriter.fileName("../.x")).doesNotContain("..").doesNotContain("/");
    }
}
