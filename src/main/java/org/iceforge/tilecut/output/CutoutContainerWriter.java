package org.iceforge.tilecut.output;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.NullDataHDU;
import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.batch.SourceRequest;
import org.iceforge.tilecut.extract.CutoutArtifact;
import org.iceforge.tilecut.fits.FitsSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes one FITS container per source and product type:
 * <pre>
 *   {outputDir}/{PRODUCT_TYPE}/{targetId}.fits
 * </pre>
 * HDU 0 carries no data, only {@code OBJID} and an {@code HDUn} card naming each plane.
 * Each following image HDU is one instrument/band plane. When asked to, the source's
 * catalog row is appended as a one-row binary table, pointed to by {@code SRCTABLE}.
 * <p>
 * A target id already written in the same directory gets {@code {targetId}_row{rowIndex}.fits}.
 */
@Component
public class CutoutContainerWriter {
    private static final Logger log = LoggerFactory.getLogger(CutoutContainerWriter.class);

    public Path write(Path outputDir, SourceRequest request, ProductType productType,
                      List<CutoutArtifact> planes, boolean attachCatalogRow) {
        if (planes.isEmpty()) {
            throw new IllegalArgumentException("No planes to write for " + request.targetId());
        }
        Path dst = outputDir.resolve(productType.code()).resolve(fileName(request.targetId()));
        try {
            dst = claim(dst, request);
            Fits fits = new Fits();
            NullDataHDU primary = new NullDataHDU();
            Header ph = primary.getHeader();
            ph.addValue("OBJID", request.targetId(), "Source identifier");
            ph.addValue("RA_OBJ", request.ra(), "[deg] Requested right ascension");
            ph.addValue("DEC_OBJ", request.dec(), "[deg] Requested declination");
            ph.addValue("PRODTYPE", productType.code(), "Archive product type");
            for (int i = 0; i < planes.size(); i++) {
                CutoutArtifact p = planes.get(i);
                ph.addValue("HDU" + (i + 1), p.instrument() + "_" + p.band(), "Instrument_band of HDU " + (i + 1));
            }
            boolean withRow = attachCatalogRow && !request.catalogRow().isEmpty();
            if (withRow) {
                ph.addValue("SRCTABLE", planes.size() + 1, "HDU holding the catalog row");
            }
            fits.addHDU(primary);

            for (CutoutArtifact p : planes) {
                BasicHDU<?> hdu = Fits.makeHDU(p.data());
                Header h = hdu.getHeader();
                h.addValue("EXTNAME", p.instrument() + "_" + p.band(), null);
                FitsSupport.addCards(h, p.transform());
                FitsSupport.addCards(h, p.provenance());
                h.addValue("INSTRUME", p.instrument(), "Instrument");
                h.addValue("BAND", p.band(), "Band");
                fits.addHDU(hdu);
            }
            if (withRow) {
                fits.addHDU(rowTable(request.catalogRow()));
            }
            FitsSupport.writeAtomically(fits, dst);
            log.debug("Wrote {} ({} planes)", dst, planes.size());
            return dst;
        } catch (FitsException | IOException e) {
            throw new OutputWriteException("Failed to write cutout container " + dst, e);
        }
    }

    /** Reserves the container name so rows sharing a target id never overwrite each other. */
    private static Path claim(Path dst, SourceRequest request) throws IOException {
        Files.createDirectories(dst.getParent());
        try {
            Files.createFile(dst);
            return dst;
        } catch (FileAlreadyExistsException e) {
            Path alt = dst.resolveSibling(fileName(request.targetId() + "_row" + request.rowIndex()));
            log.warn("Target id {} appears more than once; writing catalog row {} to {}",
                    request.targetId(), request.rowIndex(), alt.getFileName());
            return alt;
        }
    }

    static BinaryTableHDU rowTable(Map<String, Object> row) throws FitsException {
        BinaryTable table = new BinaryTable();
        for (Object v : row.values()) {
            table.addColumn(cell(v));
        }
        BinaryTableHDU hdu = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(table), table);
        int i = 0;
        for (String name : row.keySet()) {
            hdu.setColumnName(i++, name, null);
        }
        hdu.getHeader().addValue("EXTNAME", "SRCTABLE", null);
        return hdu;
    }

    private static Object cell(Object v) {
        if (v instanceof Number) {
            return new double[]{((Number) v).doubleValue()};
        }
        String s = v == null ? "" : v.toString().trim();
        Double d = s.isEmpty() ? null : parseOrNull(s);
        if (d != null) {
            return new double[]{d};
        }
        return new String[]{s.isEmpty() ? " " : s};
    }

    private static Double parseOrNull(String s) {
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String fileName(String targetId) {
        String safe = targetId.trim().replaceAll("[^A-Za-z0-9._+-]", "_").replace("..", "__");
        return (safe.isEmpty() ? "unknown" : safe) + ".fits";
    }
}
