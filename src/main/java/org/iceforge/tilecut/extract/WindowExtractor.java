package org.iceforge.tilecut.extract;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import org.iceforge.tilecut.fits.FitsSupport;
import org.iceforge.tilecut.sky.SkyMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Cuts pixel windows out of mosaic images and picks the nearest stamp out of PSF grids.
 * <p>
 * Neither entry point throws for an extraction problem: bad files, missing keywords and
 * off-image positions all come back as {@link CutoutArtifact.Status#FAILED} envelopes.
 */
public class WindowExtractor {
    private static final Logger log = LoggerFactory.getLogger(WindowExtractor.class);

    static final String[] STAMP_RA = {"RA"};
    static final String[] STAMP_DEC = {"Dec", "DEC"};
    static final String[] STAMP_X = {"x_center"};
    static final String[] STAMP_Y = {"y_center"};
    static final String[] STAMP_FWHM = {"FWHM"};

    public CutoutArtifact extractWindow(Path path, double ra, double dec, WindowSize size,
                                        int plane, EdgeMode edgeMode, double fillValue) {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(edgeMode, "edgeMode");
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(plane);
            if (hdu == null) {
                return CutoutArtifact.failure("No HDU " + plane + " in " + path.getFileName());
            }
            double[][] image = FitsSupport.readImage(hdu);
            TanProjection wcs = TanProjection.fromHeader(hdu.getHeader());
            double[] pixel = wcs.skyToPixel(ra, dec);
            return cut(image, wcs, pixel[0], pixel[1], size, edgeMode, fillValue);
        } catch (ExtractionException e) {
            return CutoutArtifact.failure(e.getMessage());
        } catch (FitsException | IOException e) {
            log.debug("Window extraction failed for {}", path, e);
            return CutoutArtifact.failure("Cannot read " + path.getFileName() + ": " + e.getMessage());
        }
    }

    /**
     * Cuts a {@code size} window centred on pixel {@code (px, py)}. The window starts at
     * {@code round(p - (n - 1) / 2)} on each axis, rounding halves up.
     */
    static CutoutArtifact cut(double[][] image, TanProjection wcs, double px, double py,
                              WindowSize size, EdgeMode edgeMode, double fillValue) {
        if (!Double.isFinite(px) || !Double.isFinite(py)) {
            return CutoutArtifact.failure("Position does not map to a finite pixel");
        }
        int ny = image.length;
        int nx = ny == 0 ? 0 : image[0].length;
        int h = size.height();
        int w = size.width();

        int x0 = (int) Math.floor(px - (w - 1) / 2.0 + 0.5);
        int y0 = (int) Math.floor(py - (h - 1) / 2.0 + 0.5);
        int x1 = x0 + w;
        int y1 = y0 + h;

        int ox0 = Math.max(0, x0);
        int oy0 = Math.max(0, y0);
        int ox1 = Math.min(nx, x1);
        int oy1 = Math.min(ny, y1);
        if (ox0 >= ox1 || oy0 >= oy1) {
            return CutoutArtifact.failure("Window at pixel (" + fmt(px) + ", " + fmt(py) + ") does not overlap the "
                    + nx + "x" + ny + " image");
        }
        boolean inside = x0 >= 0 && y0 >= 0 && x1 <= nx && y1 <= ny;

        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("XPIX", px);
        provenance.put("YPIX", py);

        switch (edgeMode) {
            case REJECT -> {
                if (!inside) {
                    return CutoutArtifact.failure("Window " + h + "x" + w + " at pixel (" + fmt(px) + ", " + fmt(py)
                            + ") extends beyond the " + nx + "x" + ny + " image");
                }
                provenance.put("XMIN", x0);
                provenance.put("YMIN", y0);
                return CutoutArtifact.success(copy(image, x0, y0, w, h, fillValue), wcs.shifted(x0, y0).toHeaderCards(), provenance);
            }
            case TRUNCATE -> {
                provenance.put("XMIN", ox0);
                provenance.put("YMIN", oy0);
                return CutoutArtifact.success(copy(image, ox0, oy0, ox1 - ox0, oy1 - oy0, fillValue),
                        wcs.shifted(ox0, oy0).toHeaderCards(), provenance);
            }
            default -> {
                provenance.put("XMIN", x0);
                provenance.put("YMIN", y0);
                return CutoutArtifact.success(copy(image, x0, y0, w, h, fillValue), wcs.shifted(x0, y0).toHeaderCards(), provenance);
            }
        }
    }

    private static double[][] copy(double[][] image, int x0, int y0, int w, int h, double fillValue) {
        int ny = image.length;
        int nx = image[0].length;
        double[][] out = new double[h][w];
        for (int y = 0; y < h; y++) {
            int sy = y0 + y;
            if (sy < 0 || sy >= ny) {
                Arrays.fill(out[y], fillValue);
                continue;
            }
            for (int x = 0; x < w; x++) {
                int sx = x0 + x;
                out[y][x] = (sx < 0 || sx >= nx) ? fillValue : image[sy][sx];
            }
        }
        return out;
    }

    /**
     * Picks the stamp nearest to the position out of a PSF grid file: HDU 1 holds the grid
     * (with {@code STMPSIZE}), HDU 2 the table of stamp positions.
     */
    public CutoutArtifact extractNearestStamp(Path path, double ra, double dec) {
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?> gridHdu = fits.getHDU(1);
            if (gridHdu == null) {
                return CutoutArtifact.failure("No stamp grid HDU in " + path.getFileName());
            }
            int stampSize = gridHdu.getHeader().getIntValue("STMPSIZE", 0);
            if (stampSize <= 0) {
                return CutoutArtifact.failure("Missing or invalid STMPSIZE in " + path.getFileName());
            }
            BasicHDU<?> tableHdu = fits.getHDU(2);
            if (!(tableHdu instanceof TableHDU)) {
                return CutoutArtifact.failure("No stamp table HDU in " + path.getFileName());
            }
            TableHDU<?> table = (TableHDU<?>) tableHdu;
            double[] stampRa = column(table, STAMP_RA, path);
            double[] stampDec = column(table, STAMP_DEC, path);
            double[] xCenter = column(table, STAMP_X, path);
            double[] yCenter = column(table, STAMP_Y, path);
            Optional<Integer> fwhmCol = FitsSupport.findColumn(table, STAMP_FWHM);
            double[] fwhm = fwhmCol.isPresent() ? FitsSupport.readColumn(table, fwhmCol.get()) : null;

            int idx = nearest(stampRa, stampDec, ra, dec);
            if (idx < 0) {
                return CutoutArtifact.failure("Stamp table in " + path.getFileName() + " has no usable positions");
            }

            double[][] grid = FitsSupport.readImage(gridHdu);
            double[][] stamp = cutStamp(grid, stampSize, xCenter[idx], yCenter[idx]);

            Map<String, Object> provenance = new LinkedHashMap<>();
            provenance.put("STMPSIZE", stampSize);
            provenance.put("PSF_IDX", idx);
            provenance.put("PSF_RA", stampRa[idx]);
            provenance.put("PSF_DEC", stampDec[idx]);
            provenance.put("PSF_XCTR", xCenter[idx]);
            provenance.put("PSF_YCTR", yCenter[idx]);
            if (fwhm != null && Double.isFinite(fwhm[idx])) {
                provenance.put("PSF_FWHM", fwhm[idx]);
            }
            return CutoutArtifact.success(stamp, Map.of(), provenance);
        } catch (ExtractionException e) {
            return CutoutArtifact.failure(e.getMessage());
        } catch (FitsException | IOException e) {
            log.debug("Stamp extraction failed for {}", path, e);
            return CutoutArtifact.failure("Cannot read " + path.getFileName() + ": " + e.getMessage());
        }
    }

    private static double[] column(TableHDU<?> table, String[] names, Path path) throws FitsException {
        Optional<Integer> col = FitsSupport.findColumn(table, names);
        if (col.isEmpty()) {
            throw new ExtractionException("Stamp table in " + path.getFileName() + " has no column " + names[0]);
        }
        return FitsSupport.readColumn(table, col.get());
    }

    /** Index of the stamp closest to the position; the lowest index wins ties. -1 if none. */
    static int nearest(double[] stampRa, double[] stampDec, double ra, double dec) {
        int best = -1;
        double bestSep = Double.POSITIVE_INFINITY;
        for (int i = 0; i < Math.min(stampRa.length, stampDec.length); i++) {
            if (!Double.isFinite(stampRa[i]) || !Double.isFinite(stampDec[i])) {
                continue;
            }
            double sep = SkyMath.separationDeg(ra, dec, stampRa[i], stampDec[i]);
            if (sep < bestSep) {
                best = i;
                bestSep = sep;
            }
        }
        return best;
    }

    /**
     * Cuts a {@code stampSize} square around a stamp centre. Bounds are clamped to the grid;
     * if clamping leaves fewer than {@code stampSize} pixels on either axis the stamp fails
     * instead of coming back short.
     */
    static double[][] cutStamp(double[][] grid, int stampSize, double xCenter, double yCenter) {
        if (!Double.isFinite(xCenter) || !Double.isFinite(yCenter)) {
            throw new ExtractionException("Stamp centre is not finite");
        }
        int ny = grid.length;
        int nx = ny == 0 ? 0 : grid[0].length;
        int half = stampSize / 2;

        int xMin = Math.max(0, (int) (xCenter - half) - 1);
        int yMin = Math.max(0, (int) (yCenter - half) - 1);
        int xMax = Math.min(nx, xMin + stampSize);
        int yMax = Math.min(ny, yMin + stampSize);
        if (xMax - xMin != stampSize || yMax - yMin != stampSize) {
            throw new ExtractionException("Stamp at (" + fmt(xCenter) + ", " + fmt(yCenter) + ") does not fit in the "
                    + nx + "x" + ny + " grid: got " + (yMax - yMin) + "x" + (xMax - xMin) + ", expected "
                    + stampSize + "x" + stampSize);
        }
        double[][] out = new double[stampSize][];
        for (int y = 0; y < stampSize; y++) {
            out[y] = Arrays.copyOfRange(grid[yMin + y], xMin, xMax);
        }
        return out;
    }

    private static String fmt(double v) {
        return String.format(java.util.Locale.ROOT, "%.2f", v);
    }
}
