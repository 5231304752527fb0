package org.iceforge.tilecut.archive;

public class ArchiveAccessException extends RuntimeException {
    public ArchiveAccessException(String message) {
        super(message);
    }

    public ArchiveAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
