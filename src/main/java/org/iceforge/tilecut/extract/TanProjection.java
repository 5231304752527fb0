package org.iceforge.tilecut.extract;

import nom.tam.fits.Header;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gnomonic (TAN) world coordinate transform as described by FITS header cards.
 * <p>
 * Pixel coordinates handled by this class are 0-based; FITS {@code CRPIX} values are 1-based.
 */
public final class TanProjection {

    private final String ctype1;
    private final String ctype2;
    private final double crval1;
    private final double crval2;
    private final double crpix1;
    private final double crpix2;
    private final double cd11;
    private final double cd12;
    private final double cd21;
    private final double cd22;

    public TanProjection(double crval1, double crval2, double crpix1, double crpix2,
                         double cd11, double cd12, double cd21, double cd22) {
        this("RA---TAN", "DEC--TAN", crval1, crval2, crpix1, crpix2, cd11, cd12, cd21, cd22);
    }

    private TanProjection(String ctype1, String ctype2, double crval1, double crval2, double crpix1, double crpix2,
                          double cd11, double cd12, double cd21, double cd22) {
        double det = cd11 * cd22 - cd12 * cd21;
        if (det == 0.0 || !Double.isFinite(det)) {
            throw new ExtractionException("Singular CD matrix");
        }
        this.ctype1 = ctype1;
        this.ctype2 = ctype2;
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
    }

    public static TanProjection fromHeader(Header h) {
        String ctype1 = h.getStringValue("CTYPE1");
        String ctype2 = h.getStringValue("CTYPE2");
        if ((ctype1 != null && !ctype1.contains("TAN")) || (ctype2 != null && !ctype2.contains("TAN"))) {
            throw new ExtractionException("Unsupported projection: " + ctype1 + "/" + ctype2);
        }
        for (String key : new String[]{"CRVAL1", "CRVAL2", "CRPIX1", "CRPIX2"}) {
            if (!h.containsKey(key)) {
                throw new ExtractionException("Missing WCS keyword " + key);
            }
        }
        double cd11;
        double cd12;
        double cd21;
        double cd22;
        if (h.containsKey("CD1_1") || h.containsKey("CD2_2")) {
            cd11 = h.getDoubleValue("CD1_1", 0.0);
            cd12 = h.getDoubleValue("CD1_2", 0.0);
            cd21 = h.getDoubleValue("CD2_1", 0.0);
            cd22 = h.getDoubleValue("CD2_2", 0.0);
        } else if (h.containsKey("CDELT1") && h.containsKey("CDELT2")) {
            double cdelt1 = h.getDoubleValue("CDELT1", 0.0);
            double cdelt2 = h.getDoubleValue("CDELT2", 0.0);
            cd11 = cdelt1 * h.getDoubleValue("PC1_1", 1.0);
            cd12 = cdelt1 * h.getDoubleValue("PC1_2", 0.0);
            cd21 = cdelt2 * h.getDoubleValue("PC2_1", 0.0);
            cd22 = cdelt2 * h.getDoubleValue("PC2_2", 1.0);
        } else {
            throw new ExtractionException("Missing CD matrix or CDELT keywords");
        }
        return new TanProjection(
                ctype1 != null ? ctype1.trim() : "RA---TAN",
                ctype2 != null ? ctype2.trim() : "DEC--TAN",
                h.getDoubleValue("CRVAL1", 0.0), h.getDoubleValue("CRVAL2", 0.0),
                h.getDoubleValue("CRPIX1", 0.0), h.getDoubleValue("CRPIX2", 0.0),
                cd11, cd12, cd21, cd22);
    }

    /**
     * Projects a sky position to a 0-based pixel position {@code {x, y}}.
     *
     * @throws ExtractionException if the position is 90 degrees or more from the tangent point
     */
    public double[] skyToPixel(double ra, double dec) {
        double a = Math.toRadians(ra);
        double d = Math.toRadians(dec);
        double a0 = Math.toRadians(crval1);
        double d0 = Math.toRadians(crval2);
        double da = a - a0;

        double cosc = Math.sin(d0) * Math.sin(d) + Math.cos(d0) * Math.cos(d) * Math.cos(da);
        if (cosc <= 0.0) {
            throw new ExtractionException("Position ra=" + ra + " dec=" + dec + " is not on the projected hemisphere");
        }
        double xi = Math.toDegrees(Math.cos(d) * Math.sin(da) / cosc);
        double eta = Math.toDegrees((Math.cos(d0) * Math.sin(d) - Math.sin(d0) * Math.cos(d) * Math.cos(da)) / cosc);

        double det = cd11 * cd22 - cd12 * cd21;
        double dx = (cd22 * xi - cd12 * eta) / det;
        double dy = (-cd21 * xi + cd11 * eta) / det;
        return new double[]{crpix1 + dx - 1.0, crpix2 + dy - 1.0};
    }

    /**
     * Inverse of {@link #skyToPixel}: 0-based pixel position to {@code {ra, dec}} in degrees.
     */
    public double[] pixelToSky(double x, double y) {
        double px = x + 1.0 - crpix1;
        double py = y + 1.0 - crpix2;
        double xi = Math.toRadians(cd11 * px + cd12 * py);
        double eta = Math.toRadians(cd21 * px + cd22 * py);
        double d0 = Math.toRadians(crval2);

        double dec = Math.asin((Math.sin(d0) + eta * Math.cos(d0)) / Math.sqrt(1.0 + xi * xi + eta * eta));
        double ra = Math.toRadians(crval1) + Math.atan2(xi, Math.cos(d0) - eta * Math.sin(d0));
        double raDeg = Math.toDegrees(ra) % 360.0;
        if (raDeg < 0) {
            raDeg += 360.0;
        }
        return new double[]{raDeg, Math.toDegrees(dec)};
    }

    /**
     * The same projection for a sub-image whose pixel (0,0) is pixel {@code (x0, y0)} here.
     */
    public TanProjection shifted(int x0, int y0) {
        return new TanProjection(ctype1, ctype2, crval1, crval2, crpix1 - x0, crpix2 - y0, cd11, cd12, cd21, cd22);
    }

    /** Header cards describing this projection, in FITS order. */
    public Map<String, Object> toHeaderCards() {
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("CTYPE1", ctype1);
        cards.put("CTYPE2", ctype2);
        cards.put("CRVAL1", crval1);
        cards.put("CRVAL2", crval2);
        cards.put("CRPIX1", crpix1);
        cards.put("CRPIX2", crpix2);
        cards.put("CD1_1", cd11);
        cards.put("CD1_2", cd12);
        cards.put("CD2_1", cd21);
        cards.put("CD2_2", cd22);
        return cards;
    }

    public double crpix1() {
        return crpix1;
    }

    public double crpix2() {
        return crpix2;
    }
}
