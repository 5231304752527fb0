package org.iceforge.tilecut.output;

public class OutputWriteException extends RuntimeException {
    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
