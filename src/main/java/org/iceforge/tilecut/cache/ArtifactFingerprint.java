package org.iceforge.tilecut.cache;

import org.iceforge.tilecut.extract.WindowSize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Content address of one extraction.
 * <p>
 * Positions are rounded to six decimal places (about 3.6 milliarcseconds) so requests that
 * differ only by float noise share an entry. Build instances with {@link #of}.
 */
public record ArtifactFingerprint(
        double ra,
        double dec,
        WindowSize size,
        String instrument,
        String productType,
        String band
) {
    public static final int POSITION_DECIMALS = 6;
    public static final String UNKNOWN_BAND = "unknown";

    public ArtifactFingerprint {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(productType, "productType");
        if (band == null || band.isBlank()) {
            band = UNKNOWN_BAND;
        }
    }

    public static ArtifactFingerprint of(double ra, double dec, WindowSize size,
                                         String instrument, String productType, String band) {
        return new ArtifactFingerprint(round(ra), round(dec), size, instrument, productType, band);
    }

    static double round(double v) {
        if (!Double.isFinite(v)) {
            throw new IllegalArgumentException("Position must be finite, got " + v);
        }
        return BigDecimal.valueOf(v).setScale(POSITION_DECIMALS, RoundingMode.HALF_EVEN).doubleValue() + 0.0;
    }

    public String canonical() {
        return String.format(Locale.ROOT, "ra_%.6f_dec_%.6f_size_%s_inst_%s_type_%s_band_%s",
                ra, dec, size, instrument, productType, band);
    }

    public String hash() {
        return CacheKeys.sha256Hex(canonical());
    }
}
