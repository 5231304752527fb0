package org.iceforge.tilecut.extract;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * What to do when a requested window runs off the edge of the image.
 */
public enum EdgeMode {
    /** Return the full requested size; pixels outside the image get the fill value. */
    FILL,
    /** Return only the part that overlaps the image. */
    TRUNCATE,
    /** Fail unless the whole window lies inside the image. */
    REJECT;

    /**
     * Accepts the enum names as well as the {@code partial}, {@code trim} and {@code strict}
     * aliases.
     */
    @JsonCreator
    public static EdgeMode parse(String value) {
        if (value == null || value.isBlank()) {
            return FILL;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fill":
            case "partial":
                return FILL;
            case "truncate":
            case "trim":
                return TRUNCATE;
            case "reject":
            case "strict":
                return REJECT;
            default:
                throw new IllegalArgumentException("Unknown edge mode: " + value);
        }
    }
}
