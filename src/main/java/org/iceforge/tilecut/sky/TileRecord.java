package org.iceforge.tilecut.sky;

import java.util.Objects;

/**
 * One archive tile: its id, the RA/Dec bounding box of the sources it holds, the mean
 * position of those sources and how many there are.
 */
public record TileRecord(
        String tileId,
        double raMin,
        double raMax,
        double decMin,
        double decMax,
        double raCenter,
        double decCenter,
        long sourceCount
) {
    public TileRecord {
        Objects.requireNonNull(tileId, "tileId");
        if (tileId.isBlank()) {
            throw new IllegalArgumentException("tileId must not be blank");
        }
        if (!(raMin < raMax) || !(decMin < decMax)) {
            throw new IllegalArgumentException("Degenerate bounding box for tile " + tileId
                    + ": ra=[" + raMin + "," + raMax + "] dec=[" + decMin + "," + decMax + "]");
        }
        if (sourceCount < 0) {
            throw new IllegalArgumentException("sourceCount must be >= 0 for tile " + tileId);
        }
    }

    /**
     * Whether the position lies inside the bounding box grown by {@code tolerance} degrees
     * on every side. Bounds are inclusive.
     */
    public boolean contains(double ra, double dec, double tolerance) {
        return raMin - tolerance <= ra && ra <= raMax + tolerance
                && decMin - tolerance <= dec && dec <= decMax + tolerance;
    }

    public double separationFromCenter(double ra, double dec) {
        return SkyMath.separationDeg(ra, dec, raCenter, decCenter);
    }
}
