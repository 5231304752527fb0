package org.iceforge.tilecut.batch;

/**
 * A batch stopped early because shared storage failed. Per-source problems never cause
 * this; they are counted in the report instead.
 */
public class BatchAbortedException extends RuntimeException {
    public BatchAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
