package org.iceforge.tilecut.cache;

public interface CacheMetrics {
    long hits();

    long misses();

    long bytesUsed();
}
