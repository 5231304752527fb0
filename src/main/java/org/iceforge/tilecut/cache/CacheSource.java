package org.iceforge.tilecut.cache;

/**
 * Where a cache answer came from.
 */
public enum CacheSource {
    EPHEMERAL,
    PERMANENT,
    COMPUTED
}
