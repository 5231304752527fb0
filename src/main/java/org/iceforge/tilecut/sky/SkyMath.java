package org.iceforge.tilecut.sky;

/**
 * Spherical helpers. All angles are in degrees.
 */
public final class SkyMath {

    private SkyMath() {}

    /**
     * Great-circle separation between two sky positions using the Vincenty formula,
     * which stays accurate for both tiny and antipodal separations.
     */
    public static double separationDeg(double ra1, double dec1, double ra2, double dec2) {
        double l1 = Math.toRadians(ra1);
        double l2 = Math.toRadians(ra2);
        double b1 = Math.toRadians(dec1);
        double b2 = Math.toRadians(dec2);

        double dl = l2 - l1;
        double sdl = Math.sin(dl);
        double cdl = Math.cos(dl);
        double sb1 = Math.sin(b1);
        double cb1 = Math.cos(b1);
        double sb2 = Math.sin(b2);
        double cb2 = Math.cos(b2);

        double num1 = cb2 * sdl;
        double num2 = cb1 * sb2 - sb1 * cb2 * cdl;
        double denominator = sb1 * sb2 + cb1 * cb2 * cdl;
        return Math.toDegrees(Math.atan2(Math.hypot(num1, num2), denominator));
    }
}
