package org.iceforge.tilecut.cache;

public enum CacheOutcome {
    /** Served from a tier. */
    HIT,
    /** Extracted now and stored. */
    COMPUTED,
    /** Extraction failed; nothing stored. */
    FAILED,
    /** Extracted, but the pixels hold NaN/inf and the caller rejects those; nothing stored. */
    INVALID
}
