package org.iceforge.tilecut.cache;

/**
 * A cache tier could not be read or written.
 */
public class ArtifactStoreException extends RuntimeException {
    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
