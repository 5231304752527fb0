package org.iceforge.tilecut.catalog;

/**
 * The catalog cannot be used: unreadable, unknown format, or no usable position columns.
 */
public class CatalogFormatException extends RuntimeException {
    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
