package org.iceforge.tilecut.archive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Archive product kinds a cutout can be taken from.
 */
public enum ProductType {
    BGSUB("BGSUB"),
    BGMOD("BGMOD"),
    FLAG("FLAG"),
    RMS("RMS"),
    CATALOG_PSF("CATALOG-PSF");

    private final String code;

    ProductType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** PSF products hold a grid of stamps rather than a mosaic. */
    public boolean isStampGrid() {
        return this == CATALOG_PSF;
    }

    @JsonCreator
    public static ProductType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Product type must not be null");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (ProductType t : values()) {
            if (t.code.equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown product type: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
