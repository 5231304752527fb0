package org.iceforge.tilecut.batch;

public enum FailureKind {
    /** No tile covers the position. */
    NO_TILE,
    /** The tile has no file for the requested instrument/band/product. */
    NOT_FOUND,
    EXTRACTION_FAILURE,
    /** Pixels contain NaN/inf and the task rejects those. */
    INVALID_PAYLOAD,
    /** The tile directory disappeared while its group was being processed. */
    TILE_ABANDONED,
    /** Listing the tile directory failed. */
    ARCHIVE_ERROR,
    CANCELLED
}
